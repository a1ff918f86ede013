package com.sporty.qcache.example;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class MemberRepository {
    final Map<Long, Member> records = new ConcurrentHashMap<>();
    final AtomicLong id = new AtomicLong(1);

    public Member save(final Member data) {
        return Optional
                .ofNullable(data.getId() == null ? null : records.get(data.getId()))
                // update
                .map(v -> {
                    if (data.getName() != null) {
                        v.setName(data.getName());
                    }
                    if (data.getAge() != null) {
                        v.setAge(data.getAge());
                    }
                    if (data.getTeam() != null) {
                        v.setTeam(data.getTeam());
                    }
                    if (data.getTags() != null) {
                        v.setTags(List.copyOf(data.getTags()));
                    }
                    v.setUpdateTime(Instant.now());

                    return v;
                })
                // insert, an explicit id is kept
                .orElseGet(() -> {
                    if (data.getId() == null) {
                        data.setId(id.getAndAdd(1L));
                    } else {
                        id.accumulateAndGet(data.getId() + 1, Math::max);
                    }
                    data.setCreateTime(Instant.now());
                    data.setUpdateTime(Instant.now());
                    records.put(data.getId(), data);
                    return data;
                });
    }

    /**
     * Snapshot of every member ordered by id. Each call stands for one round trip to the store.
     */
    public List<Member> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(Member::getId))
                .toList();
    }

    public Optional<Member> findById(final Long id) {
        return Optional.ofNullable(records.get(id));
    }

    public void delete(final Long id) {
        records.remove(id);
    }
}
