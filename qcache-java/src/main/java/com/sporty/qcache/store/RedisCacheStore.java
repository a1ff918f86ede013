package com.sporty.qcache.store;

import com.sporty.qcache.exception.QCacheStoreOperateException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

public class RedisCacheStore implements CacheStore {
    private final StringRedisTemplate stringRedisTemplate;

    public RedisCacheStore(final StringRedisTemplate stringRedisTemplate) {
        if (stringRedisTemplate == null) {
            throw new IllegalArgumentException("stringRedisTemplate is null");
        }
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public Optional<String> get(final String key) {
        try {
            return Optional.ofNullable(stringRedisTemplate.opsForValue().get(key));
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to read from Redis cache for key: " + key, e);
        }
    }

    @Override
    public void set(final String key, final String value, final Duration ttl) {
        try {
            stringRedisTemplate.opsForValue().set(key, value, ttl);
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to write data to Redis cache for key: " + key, e);
        }
    }

    @Override
    public void delete(final String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to delete Redis cache for key: " + key, e);
        }
    }

    @Override
    public void deleteAll(final Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        try {
            stringRedisTemplate.delete(keys);
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to delete Redis cache for keys: " + keys, e);
        }
    }

    @Override
    public Set<String> keys(final String pattern) {
        try {
            final Set<String> keys = stringRedisTemplate.keys(pattern);
            return keys == null ? Set.of() : keys;
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to list Redis keys for pattern: " + pattern, e);
        }
    }

    @Override
    public Optional<Duration> ttl(final String key) {
        final Long seconds;
        try {
            seconds = stringRedisTemplate.getExpire(key, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new QCacheStoreOperateException("Failed to read Redis TTL for key: " + key, e);
        }
        // -2: no such key, -1: key without expiry
        if (seconds == null || seconds == -2L) {
            return Optional.empty();
        }
        return Optional.of(seconds == -1L ? Duration.ZERO : Duration.ofSeconds(seconds));
    }
}
