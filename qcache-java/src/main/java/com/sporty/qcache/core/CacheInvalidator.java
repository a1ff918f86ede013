package com.sporty.qcache.core;

import com.sporty.qcache.store.CacheStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps mutations so the cache entries they affect are deleted once they succeed.
 * <p>
 * Sample Code:
 * <pre>
 * final Member saved = cacheInvalidator
 *     .withManagerInvalidation(memberCacheManager, () -&gt; memberRepository.save(member))
 *     .get();
 *
 * cacheInvalidator
 *     .withCacheKeyInvalidation(List.of("member", "member_" + id), () -&gt; memberRepository.delete(id))
 *     .run();
 * </pre>
 *
 * The wrapped operation's result or exception passes through untouched, and nothing is deleted when it throws.
 * A failed delete after a successful operation is only logged, the entries then live until their TTL.
 *
 * @see com.sporty.qcache.example.MemberController
 */
@Slf4j
public class CacheInvalidator {
    private final CacheStore cacheStore;

    public CacheInvalidator(final CacheStore cacheStore) {
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore is null");
        }
        this.cacheStore = cacheStore;
    }

    public Runnable withCacheKeyInvalidation(final List<String> keys, final Runnable operation) {
        final List<String> cacheKeys = List.copyOf(keys);
        return () -> {
            operation.run();
            invalidate(cacheKeys);
        };
    }

    public <R> Supplier<R> withCacheKeyInvalidation(final List<String> keys, final Supplier<R> operation) {
        final List<String> cacheKeys = List.copyOf(keys);
        return () -> {
            final R result = operation.get();
            invalidate(cacheKeys);
            return result;
        };
    }

    public <A, R> Function<A, R> withCacheKeyInvalidation(final List<String> keys, final Function<A, R> operation) {
        final List<String> cacheKeys = List.copyOf(keys);
        return argument -> {
            final R result = operation.apply(argument);
            invalidate(cacheKeys);
            return result;
        };
    }

    public <R> Supplier<R> withManagerInvalidation(final CacheManager<?, ?> manager, final Supplier<R> operation) {
        return withManagerInvalidation(manager, List.of(), operation);
    }

    /**
     * Deletes the manager's collection key, the detail key the result points at when the operation returns one of the
     * manager's records or an identifier, and {@code additionalKeys}.
     */
    public <R> Supplier<R> withManagerInvalidation(
            final CacheManager<?, ?> manager,
            final List<String> additionalKeys,
            final Supplier<R> operation
    ) {
        final List<String> extraKeys = List.copyOf(additionalKeys);
        return () -> {
            final R result = operation.get();
            invalidate(managerKeys(manager, manager.detailCacheKeyOf(result), extraKeys));
            return result;
        };
    }

    public <A, R> Function<A, R> withManagerInvalidation(
            final CacheManager<?, ?> manager,
            final List<String> additionalKeys,
            final Function<A, R> operation
    ) {
        final List<String> extraKeys = List.copyOf(additionalKeys);
        return argument -> {
            final R result = operation.apply(argument);
            invalidate(managerKeys(manager, manager.detailCacheKeyOf(result), extraKeys));
            return result;
        };
    }

    /**
     * Sample Code:
     * <pre>
     * cacheInvalidator
     *     .withManagerInvalidation(memberCacheManager, Member::getName, List.of(), () -&gt; memberRepository.save(member))
     *     .get();
     * </pre>
     *
     * Same as {@link #withManagerInvalidation(CacheManager, List, Supplier)} for details fetched under
     * {@code keyField} instead of the identifier, e.g. {@code fetchDetail(name, Criteria.where("name", name))}.
     */
    public <T, R> Supplier<R> withManagerInvalidation(
            final CacheManager<T, ?> manager,
            final Function<? super T, ?> keyField,
            final List<String> additionalKeys,
            final Supplier<R> operation
    ) {
        if (keyField == null) {
            throw new IllegalArgumentException("keyField is null");
        }
        final List<String> extraKeys = List.copyOf(additionalKeys);
        return () -> {
            final R result = operation.get();
            invalidate(managerKeys(manager, manager.detailCacheKeyOf(result, keyField), extraKeys));
            return result;
        };
    }

    public <T, A, R> Function<A, R> withManagerInvalidation(
            final CacheManager<T, ?> manager,
            final Function<? super T, ?> keyField,
            final List<String> additionalKeys,
            final Function<A, R> operation
    ) {
        if (keyField == null) {
            throw new IllegalArgumentException("keyField is null");
        }
        final List<String> extraKeys = List.copyOf(additionalKeys);
        return argument -> {
            final R result = operation.apply(argument);
            invalidate(managerKeys(manager, manager.detailCacheKeyOf(result, keyField), extraKeys));
            return result;
        };
    }

    private static List<String> managerKeys(
            final CacheManager<?, ?> manager,
            final Optional<String> detailKey,
            final List<String> additionalKeys
    ) {
        final Set<String> keys = new LinkedHashSet<>();
        keys.add(manager.collectionCacheKey(null));
        detailKey.ifPresent(keys::add);
        keys.addAll(additionalKeys);
        return new ArrayList<>(keys);
    }

    private void invalidate(final List<String> cacheKeys) {
        try {
            cacheStore.deleteAll(cacheKeys);
            log.debug("Invalidated cache keys: {}", cacheKeys);
        } catch (Exception e) {
            log.error("Failed to invalidate cache keys: {}, entries stay until they expire", cacheKeys, e);
        }
    }
}
