package com.sporty.qcache.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-process {@link CacheStore} honouring a TTL per entry.
 * <p>
 * Entries are not shared between processes, so this store fits single-instance deployments and tests.
 */
public class CaffeineCacheStore implements CacheStore {
    private final Cache<String, Entry> caffeineCache;

    private static final class Entry {
        private final String value;
        private final Duration ttl;

        private Entry(final String value, final Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }

    public CaffeineCacheStore(final Long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineCacheStore(final Long maximumSize, final Ticker ticker) {
        if (maximumSize == null || maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize is null or invalid");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker is null");
        }
        this.caffeineCache = Caffeine
                .newBuilder()
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(final String key, final Entry entry, final long currentTime) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(final String key, final Entry entry, final long currentTime, final long currentDuration) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(final String key, final Entry entry, final long currentTime, final long currentDuration) {
                        return currentDuration;
                    }
                })
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> get(final String key) {
        return Optional.ofNullable(caffeineCache.getIfPresent(key)).map(entry -> entry.value);
    }

    @Override
    public void set(final String key, final String value, final Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl is null or invalid");
        }
        caffeineCache.put(key, new Entry(value, ttl));
    }

    @Override
    public void delete(final String key) {
        caffeineCache.invalidate(key);
    }

    @Override
    public void deleteAll(final Collection<String> keys) {
        caffeineCache.invalidateAll(keys);
    }

    @Override
    public Set<String> keys(final String pattern) {
        final Pattern regex = globToRegex(pattern);
        return caffeineCache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public Optional<Duration> ttl(final String key) {
        return caffeineCache.policy().expireVariably().flatMap(expiration -> expiration.getExpiresAfter(key));
    }

    private static Pattern globToRegex(final String pattern) {
        final StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                regex.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && pattern.indexOf(']', i + 1) > i + 1) {
                final int end = pattern.indexOf(']', i + 1);
                regex.append(characterClass(pattern.substring(i + 1, end)));
                i = end;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String characterClass(final String body) {
        final boolean negated = body.startsWith("^") && body.length() > 1;
        final StringBuilder characterClass = new StringBuilder(negated ? "[^" : "[");
        for (final char c : (negated ? body.substring(1) : body).toCharArray()) {
            if (c == '\\' || c == '[' || c == '^' || c == '&') {
                characterClass.append('\\');
            }
            characterClass.append(c);
        }
        return characterClass.append(']').toString();
    }
}
