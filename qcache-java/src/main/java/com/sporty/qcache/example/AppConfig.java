package com.sporty.qcache.example;

import com.sporty.qcache.core.CacheInvalidator;
import com.sporty.qcache.core.CacheManager;
import com.sporty.qcache.core.CacheManagerConfig;
import com.sporty.qcache.core.CacheManagerDefaultImpl;
import com.sporty.qcache.exception.ErrorKind;
import com.sporty.qcache.store.CacheStore;
import com.sporty.qcache.store.RedisCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Configuration
public class AppConfig {
    @Bean
    public CacheStore cacheStore(final StringRedisTemplate stringRedisTemplate) {
        return new RedisCacheStore(stringRedisTemplate);
    }

    @Bean
    public CacheManager<Member, Long> memberCacheManager(
            final MemberDataSource memberDataSource,
            final CacheStore cacheStore,
            @Value("${qcache.member.list-timeout:P1D}") final Duration listTimeout,
            @Value("${qcache.member.detail-timeout:PT1M}") final Duration detailTimeout
    ) {
        return new CacheManagerDefaultImpl<>(
                CacheManagerConfig
                        .builder(Member.class)
                        .cacheKey("member")
                        .relatedObjects(List.of("team"))
                        .prefetchRelatedObjects(List.of("tags"))
                        .listTimeout(listTimeout)
                        .detailTimeout(detailTimeout)
                        .build(),
                memberDataSource,
                cacheStore);
    }

    @Bean
    public CacheInvalidator cacheInvalidator(final CacheStore cacheStore) {
        return new CacheInvalidator(cacheStore);
    }

    @Bean
    public ErrorKindStatuses errorKindStatuses() {
        return new ErrorKindStatuses(Map.of(
                ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND,
                ErrorKind.GONE, HttpStatus.GONE,
                ErrorKind.FORBIDDEN, HttpStatus.FORBIDDEN));
    }

    @Bean
    public ApplicationRunner memberSeeder(final MemberRepository memberRepository) {
        return args -> List.of(
                new Member(null, "Vincent", 18, "red", List.of("founder"), null, null),
                new Member(null, "Alice", 25, "blue", List.of(), null, null),
                new Member(null, "Bob", 30, "red", List.of(), null, null),
                new Member(null, "Charlie", 22, "green", List.of(), null, null),
                new Member(null, "Diana", 28, "blue", List.of("captain"), null, null)
        ).forEach(memberRepository::save);
    }
}
