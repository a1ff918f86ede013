package com.sporty.qcache.core;

import com.github.benmanes.caffeine.cache.Ticker;
import com.sporty.qcache.example.Member;
import com.sporty.qcache.example.MemberDataSource;
import com.sporty.qcache.example.MemberQuery;
import com.sporty.qcache.example.MemberRepository;
import com.sporty.qcache.exception.ErrorKind;
import com.sporty.qcache.exception.QCacheNotFoundException;
import com.sporty.qcache.source.ComposableQuery;
import com.sporty.qcache.source.Criteria;
import com.sporty.qcache.store.CaffeineCacheStore;
import com.sporty.qcache.store.CacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CacheManagerReadThroughTests {
    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private MemberRepository memberRepository;
    private CacheStore cacheStore;
    private CacheManager<Member, Long> cacheManager;
    private CacheInvalidator cacheInvalidator;

    @BeforeEach
    void setUp() {
        memberRepository = Mockito.spy(new MemberRepository());
        cacheStore = Mockito.spy(new CaffeineCacheStore(1024L, ticker));
        cacheManager = new CacheManagerDefaultImpl<>(
                CacheManagerConfig
                        .builder(Member.class)
                        .cacheKey("example")
                        .relatedObjects(List.of("team"))
                        .prefetchRelatedObjects(List.of("tags"))
                        .listTimeout(Duration.ofSeconds(1))
                        .build(),
                new MemberDataSource(memberRepository),
                cacheStore);
        cacheInvalidator = new CacheInvalidator(cacheStore);
    }

    private Member member(final Long id, final String name, final String team) {
        return memberRepository.save(new Member(id, name, 20, team, List.of(), null, null));
    }

    private void advance(final Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void fetchCollection_shouldHitDataSourceOnceUntilListTimeoutExpires() {
        member(null, "Vincent", "red");

        cacheManager.fetchCollection();
        verify(memberRepository, times(1)).findAll();

        cacheManager.fetchCollection();
        verify(memberRepository, times(1)).findAll();

        advance(Duration.ofMillis(1100));

        cacheManager.fetchCollection();
        verify(memberRepository, times(2)).findAll();
    }

    @Test
    void fetchCollection_shouldStoreEntryWithListTimeout() {
        cacheManager.fetchCollection();

        assertThat(cacheStore.ttl("example")).contains(Duration.ofSeconds(1));
        assertThat(cacheStore.keys("*")).containsExactly("example");
    }

    @Test
    void fetchCollection_shouldKeepSuffixedAndPlainCollectionsApart() {
        member(null, "Vincent", "red");
        member(null, "Alice", "blue");

        final List<Member> red = cacheManager.fetchCollection("active", Criteria.where("team", "red")).list();
        final List<Member> all = cacheManager.fetchCollection().list();

        assertThat(red).extracting(Member::getName).containsExactly("Vincent");
        assertThat(all).extracting(Member::getName).containsExactly("Vincent", "Alice");
        assertThat(cacheStore.keys("example*")).containsExactlyInAnyOrder("example", "example_active");
    }

    @Test
    void fetchCollection_shouldRunChainedFilterAgainstDataSourceWithoutCaching() {
        member(null, "Vincent", "red");
        member(null, "Alice", "blue");
        final ComposableQuery<Member, Long> all = cacheManager.fetchCollection();
        clearInvocations(cacheStore, memberRepository);

        final List<Member> blue = all.filter(Criteria.where("team", "blue")).list();

        assertThat(blue).extracting(Member::getName).containsExactly("Alice");
        verify(memberRepository, times(1)).findAll();
        verify(cacheStore, never()).get(anyString());
        verify(cacheStore, never()).set(anyString(), anyString(), any(Duration.class));
        assertThat(cacheStore.keys("*")).containsExactly("example");
    }

    @Test
    void fetchCollection_shouldServeLiveFieldsInStoredOrderWhenHit() {
        final Member bob = member(null, "Bob", "red");
        member(null, "Alice", "red");
        cacheManager.fetchCollection("by_name", Criteria.where("team", "red"));
        bob.setName("Robert");
        member(null, "Charlie", "red");

        final ComposableQuery<Member, Long> cached = cacheManager.fetchCollection("by_name", Criteria.where("team", "red"));

        assertThat(cached.list()).extracting(Member::getName).containsExactly("Robert", "Alice");
        assertThat(((MemberQuery) cached).getEagerLoad()).containsExactly("team", "tags");
    }

    @Test
    void fetchDetail_shouldThrowUntilRecordExistsThenCacheIt() {
        final Criteria criteria = Criteria.where("id", 1L);

        assertThatThrownBy(() -> cacheManager.fetchDetail(1L, criteria))
                .isInstanceOf(QCacheNotFoundException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(cacheStore.get("example_1")).isEmpty();

        member(1L, "Vincent", "red");

        final Member found = cacheManager.fetchDetail(1L, criteria);

        assertThat(found.getId()).isEqualTo(1L);
        assertThat(found.getName()).isEqualTo("Vincent");
        assertThat(cacheStore.get("example_1")).isPresent();
        assertThat(cacheStore.ttl("example_1")).contains(Duration.ofMinutes(1));
    }

    @Test
    void fetchDetail_shouldRevalidateCachedRecordAgainstDataSource() {
        member(1L, "Vincent", "red");
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));

        memberRepository.delete(1L);

        assertThatThrownBy(() -> cacheManager.fetchDetail(1L, Criteria.where("id", 1L)))
                .isInstanceOf(QCacheNotFoundException.class);
        assertThat(cacheStore.get("example_1")).isEmpty();
    }

    @Test
    void fetchDetail_shouldReturnCachedFieldsUntilDetailTimeout() {
        final Member vincent = member(1L, "Vincent", "red");
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));
        vincent.setName("Vince");

        assertThat(cacheManager.fetchDetail(1L, Criteria.where("id", 1L)).getName()).isEqualTo("Vincent");

        advance(Duration.ofSeconds(61));

        assertThat(cacheManager.fetchDetail(1L, Criteria.where("id", 1L)).getName()).isEqualTo("Vince");
    }

    @Test
    void withCacheKeyInvalidation_shouldForceRecomputation() {
        member(null, "Vincent", "red");
        assertThat(cacheManager.fetchCollection().list()).hasSize(1);

        cacheInvalidator
                .withCacheKeyInvalidation(List.of("example"), () -> member(null, "Alice", "blue"))
                .get();

        assertThat(cacheStore.get("example")).isEmpty();
        assertThat(cacheManager.fetchCollection().list()).extracting(Member::getName).containsExactly("Vincent", "Alice");
    }

    @Test
    void withManagerInvalidation_shouldKeepEntriesWhenMutationFails() {
        member(1L, "Vincent", "red");
        cacheManager.fetchCollection();
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));

        assertThatThrownBy(() -> cacheInvalidator
                .withManagerInvalidation(cacheManager, () -> {
                    throw new IllegalStateException("rejected");
                })
                .get())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("rejected");

        assertThat(cacheStore.get("example")).isPresent();
        assertThat(cacheStore.get("example_1")).isPresent();
    }

    @Test
    void withManagerInvalidation_shouldDeleteCollectionAndDetailOfSavedRecord() {
        final Member vincent = member(1L, "Vincent", "red");
        cacheManager.fetchCollection();
        cacheManager.fetchCollection("active", Criteria.where("team", "red"));
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));

        cacheInvalidator
                .withManagerInvalidation(cacheManager, () -> memberRepository.save(vincent))
                .get();

        assertThat(cacheStore.keys("*")).containsExactly("example_active");
    }

    @Test
    void withManagerInvalidation_shouldDeleteDetailWhenMutationReturnsIdentifier() {
        final Member vincent = member(1L, "Vincent", "red");
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));

        final Long identifier = cacheInvalidator
                .withManagerInvalidation(cacheManager, () -> {
                    vincent.setName("Vince");
                    memberRepository.save(vincent);
                    return vincent.getId();
                })
                .get();

        assertThat(identifier).isEqualTo(1L);
        assertThat(cacheStore.keys("*")).doesNotContain("example_1");
        assertThat(cacheManager.fetchDetail(1L, Criteria.where("id", 1L)).getName()).isEqualTo("Vince");
    }

    @Test
    void withManagerInvalidation_shouldDeleteDetailCachedUnderKeyField() {
        final Member vincent = member(1L, "Vincent", "red");
        cacheManager.fetchDetail("Vincent", Criteria.where("name", "Vincent"));
        assertThat(cacheStore.keys("*")).containsExactly("example_Vincent");

        cacheInvalidator
                .withManagerInvalidation(cacheManager, Member::getName, List.of(), () -> {
                    vincent.setAge(30);
                    return memberRepository.save(vincent);
                })
                .get();

        assertThat(cacheStore.keys("*")).isEmpty();
        assertThat(cacheManager.fetchDetail("Vincent", Criteria.where("name", "Vincent")).getAge()).isEqualTo(30);
    }

    @Test
    void clearCache_shouldRemoveEveryEntryOfNamespace() {
        member(1L, "Vincent", "red");
        cacheManager.fetchCollection();
        cacheManager.fetchCollection("active", Criteria.where("team", "red"));
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));
        cacheStore.set("other_1", "{}", Duration.ofMinutes(1));

        cacheManager.clearCache();

        assertThat(cacheStore.keys("*")).containsExactly("other_1");
    }

    @Test
    void clearCache_shouldMatchNamespaceLiterally() {
        member(1L, "Vincent", "red");
        cacheManager.fetchDetail(1L, Criteria.where("id", 1L));
        final CacheManager<Member, Long> globNamespaced = new CacheManagerDefaultImpl<>(
                CacheManagerConfig.builder(Member.class).cacheKey("ex?mple").build(),
                new MemberDataSource(memberRepository),
                cacheStore);
        globNamespaced.fetchDetail(1L, Criteria.where("id", 1L));

        globNamespaced.clearCache();

        assertThat(cacheStore.keys("*")).containsExactly("example_1");
    }
}
