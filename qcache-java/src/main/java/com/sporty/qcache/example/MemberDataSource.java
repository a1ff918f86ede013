package com.sporty.qcache.example;

import com.sporty.qcache.source.Criteria;
import com.sporty.qcache.source.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MemberDataSource implements DataSource<Member, Long> {
    private final MemberRepository memberRepository;

    @Override
    public MemberQuery query(final Criteria criteria, final List<String> eagerLoad) {
        return new MemberQuery(memberRepository, criteria, eagerLoad);
    }

    @Override
    public Optional<Member> queryOne(final Criteria criteria, final List<String> eagerLoad) {
        final List<Member> members = query(criteria, eagerLoad).list();
        if (members.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(1, members.size());
        }
        return members.stream().findFirst();
    }

    @Override
    public Long identifierOf(final Member record) {
        return record.getId();
    }

    @Override
    public Class<Long> identifierType() {
        return Long.class;
    }
}
