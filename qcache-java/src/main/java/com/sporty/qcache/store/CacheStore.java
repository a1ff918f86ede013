package com.sporty.qcache.store;

import com.sporty.qcache.exception.QCacheStoreOperateException;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value store holding serialized cache entries.
 * <p>
 * Every method reports a store failure as {@link QCacheStoreOperateException}.
 */
public interface CacheStore {
    Optional<String> get(final String key);

    void set(final String key, final String value, final Duration ttl);

    void delete(final String key);

    void deleteAll(final Collection<String> keys);

    /**
     * Keys matching a Redis style glob: {@code *} matches any sequence, {@code ?} one character, {@code [abc]},
     * {@code [^abc]} and {@code [a-c]} a character class, and {@code \} escapes the next character.
     */
    Set<String> keys(final String pattern);

    /**
     * Remaining time to live, or empty when the key does not exist.
     */
    Optional<Duration> ttl(final String key);
}
