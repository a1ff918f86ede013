package com.sporty.qcache.example;

import com.sporty.qcache.source.ComposableQuery;
import com.sporty.qcache.source.Criteria;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Immutable, lazily evaluated member query. Nothing reaches the repository before an enumerating method runs.
 */
@Slf4j
public class MemberQuery implements ComposableQuery<Member, Long> {
    private final MemberRepository memberRepository;
    private final List<Criteria> filters;
    private final List<Long> identifiers;
    private final Sort sort;
    private final List<String> eagerLoad;

    MemberQuery(final MemberRepository memberRepository, final Criteria criteria, final List<String> eagerLoad) {
        this(memberRepository, criteria.isEmpty() ? List.of() : List.of(criteria), null, Sort.unsorted(), List.copyOf(eagerLoad));
    }

    private MemberQuery(
            final MemberRepository memberRepository,
            final List<Criteria> filters,
            final List<Long> identifiers,
            final Sort sort,
            final List<String> eagerLoad
    ) {
        this.memberRepository = memberRepository;
        this.filters = filters;
        this.identifiers = identifiers;
        this.sort = sort;
        this.eagerLoad = eagerLoad;
    }

    public List<String> getEagerLoad() {
        return eagerLoad;
    }

    @Override
    public MemberQuery byIdentifiers(final List<Long> identifiers) {
        return new MemberQuery(memberRepository, filters, List.copyOf(identifiers), sort, eagerLoad);
    }

    @Override
    public MemberQuery filter(final Criteria criteria) {
        if (criteria.isEmpty()) {
            return this;
        }
        final List<Criteria> chained = new ArrayList<>(filters);
        chained.add(criteria);
        return new MemberQuery(memberRepository, List.copyOf(chained), identifiers, sort, eagerLoad);
    }

    @Override
    public MemberQuery orderBy(final Sort sort) {
        return new MemberQuery(memberRepository, filters, identifiers, this.sort.and(sort), eagerLoad);
    }

    @Override
    public <R> List<R> values(final Function<? super Member, ? extends R> projection) {
        return execute().<R>map(projection).toList();
    }

    @Override
    public List<Member> list() {
        return execute().toList();
    }

    private Stream<Member> execute() {
        log.debug("Executing member query, filters: {}, identifiers: {}, sort: {}, eagerLoad: {}", filters, identifiers, sort, eagerLoad);

        Stream<Member> members = memberRepository.findAll().stream()
                .filter(member -> filters.stream().allMatch(criteria -> matches(member, criteria)));

        if (identifiers != null) {
            final Map<Long, Integer> positions = new HashMap<>();
            for (int i = 0; i < identifiers.size(); i++) {
                positions.putIfAbsent(identifiers.get(i), i);
            }
            members = members
                    .filter(member -> positions.containsKey(member.getId()))
                    .sorted(Comparator.comparing(member -> positions.get(member.getId())));
        }

        if (sort.isSorted()) {
            members = members.sorted(comparator(sort));
        }

        return members;
    }

    private static boolean matches(final Member member, final Criteria criteria) {
        return criteria.conditions().entrySet().stream()
                .allMatch(condition -> MemberFields.matches(member, condition.getKey(), condition.getValue()));
    }

    private static Comparator<Member> comparator(final Sort sort) {
        Comparator<Member> comparator = null;
        for (final Sort.Order order : sort) {
            final String property = order.getProperty();
            Comparator<Member> next = (left, right) -> compareValues(
                    MemberFields.valueOf(left, property),
                    MemberFields.valueOf(right, property));
            if (order.isDescending()) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    // nulls last
    @SuppressWarnings("unchecked")
    private static int compareValues(final Object left, final Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : 1) : -1;
        }
        return ((Comparable<Object>) left).compareTo(right);
    }
}
