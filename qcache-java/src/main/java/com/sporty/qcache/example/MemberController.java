package com.sporty.qcache.example;

import com.sporty.qcache.core.CacheInvalidator;
import com.sporty.qcache.core.CacheManager;
import com.sporty.qcache.source.ComposableQuery;
import com.sporty.qcache.source.Criteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/members")
@RequiredArgsConstructor
public class MemberController {
    private final CacheManager<Member, Long> memberCacheManager;
    private final CacheInvalidator cacheInvalidator;
    private final MemberRepository memberRepository;

    @GetMapping
    public ResponseEntity<List<Member>> query(
            @RequestParam(required = false) final String team,
            @RequestParam(required = false) final String sort
    ) {
        final ComposableQuery<Member, Long> members = team == null
                ? memberCacheManager.fetchCollection()
                : memberCacheManager.fetchCollection(teamSuffix(team), Criteria.where("team", team));

        // sorting runs on the data source and is never cached
        return ResponseEntity.ok(sort == null ? members.list() : members.orderBy(Sort.by(sort)).list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Member> queryById(@PathVariable final Long id) {
        return ResponseEntity.ok(memberCacheManager.fetchDetail(id, Criteria.where("id", id)));
    }

    @PostMapping
    public ResponseEntity<Member> upsert(@RequestBody final Member memberData) {
        final List<String> teamKeys = new ArrayList<>();
        if (memberData.getId() != null) {
            memberRepository.findById(memberData.getId())
                    .map(Member::getTeam)
                    .ifPresent(team -> teamKeys.add(memberCacheManager.collectionCacheKey(teamSuffix(team))));
        }
        if (memberData.getTeam() != null) {
            teamKeys.add(memberCacheManager.collectionCacheKey(teamSuffix(memberData.getTeam())));
        }

        final Member saved = cacheInvalidator
                .withManagerInvalidation(memberCacheManager, teamKeys, () -> memberRepository.save(memberData))
                .get();
        log.info("Saved member: {}", saved.getId());

        return ResponseEntity.created(URI.create("/api/members/" + saved.getId())).body(saved);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeById(@PathVariable final Long id) {
        final List<String> keys = new ArrayList<>();
        keys.add(memberCacheManager.collectionCacheKey(null));
        keys.add(memberCacheManager.detailCacheKey(id));
        memberRepository.findById(id)
                .map(Member::getTeam)
                .ifPresent(team -> keys.add(memberCacheManager.collectionCacheKey(teamSuffix(team))));

        cacheInvalidator
                .withCacheKeyInvalidation(keys, () -> memberRepository.delete(id))
                .run();

        return ResponseEntity.noContent().build();
    }

    private static String teamSuffix(final String team) {
        return "team_" + team;
    }
}
