package com.sporty.qcache.source;

import org.springframework.data.domain.Sort;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A lazily evaluated query over records of type {@code T}.
 * <p>
 * Chaining methods return a new query and never touch the data source. Only the enumerating methods
 * ({@link #list()}, {@link #stream()}, {@link #first()}, {@link #count()}, {@link #exists()}, {@link #values(Function)})
 * execute it.
 *
 * @param <T>  record type
 * @param <ID> identifier type of the record
 */
public interface ComposableQuery<T, ID> extends Iterable<T> {
    /**
     * Restricts the query to the given identifiers. Results come back in the order of {@code identifiers}
     * unless a later {@link #orderBy(Sort)} overrides it.
     */
    ComposableQuery<T, ID> byIdentifiers(final List<ID> identifiers);

    ComposableQuery<T, ID> filter(final Criteria criteria);

    ComposableQuery<T, ID> orderBy(final Sort sort);

    <R> List<R> values(final Function<? super T, ? extends R> projection);

    List<T> list();

    default Stream<T> stream() {
        return list().stream();
    }

    default Optional<T> first() {
        return stream().findFirst();
    }

    default long count() {
        return list().size();
    }

    default boolean exists() {
        return first().isPresent();
    }

    @Override
    default Iterator<T> iterator() {
        return list().iterator();
    }
}
