package com.sporty.qcache.core;

import com.sporty.qcache.exception.QCacheNotFoundException;
import com.sporty.qcache.source.ComposableQuery;
import com.sporty.qcache.source.Criteria;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache of one record type.
 * <p>
 * Sample Code:
 * <pre>
 * &#64;Bean
 * public CacheManager&lt;Member, Long&gt; memberCacheManager(
 *     final MemberDataSource memberDataSource,
 *     final CacheStore cacheStore
 * ) {
 *     return new CacheManagerDefaultImpl&lt;&gt;(
 *         CacheManagerConfig.builder(Member.class).cacheKey("member").build(),
 *         memberDataSource,
 *         cacheStore);
 * }
 * </pre>
 *
 * @see com.sporty.qcache.example.AppConfig
 */
public abstract class CacheManager<T, ID> {
    protected final CacheManagerConfig<T> config;

    protected CacheManager(final CacheManagerConfig<T> config) {
        if (config == null) {
            throw new IllegalArgumentException("config is null");
        }
        this.config = config;
    }

    public CacheManagerConfig<T> getConfig() {
        return config;
    }

    public String cacheKeyNamespace() {
        return config.namespace();
    }

    public String collectionCacheKey(final String suffix) {
        return CacheKeys.collectionKey(cacheKeyNamespace(), suffix);
    }

    public String detailCacheKey(final Object identifier) {
        return CacheKeys.detailKey(cacheKeyNamespace(), identifier);
    }

    /**
     * The detail key a mutation result points at: a record of this manager's model is keyed by its identifier, and an
     * identifier is keyed as is. Anything else yields empty.
     */
    public Optional<String> detailCacheKeyOf(final Object result) {
        return detailCacheKeyOf(result, this::identifierOf);
    }

    /**
     * Same as {@link #detailCacheKeyOf(Object)} but a record is keyed by {@code keyField}, for details fetched under
     * another field such as a slug.
     */
    public Optional<String> detailCacheKeyOf(final Object result, final Function<? super T, ?> keyField) {
        if (keyField == null) {
            throw new IllegalArgumentException("keyField is null");
        }
        if (config.getModel().isInstance(result)) {
            return Optional.ofNullable(keyField.apply(config.getModel().cast(result))).map(this::detailCacheKey);
        }
        if (identifierType().isInstance(result)) {
            return Optional.of(detailCacheKey(result));
        }
        return Optional.empty();
    }

    public ComposableQuery<T, ID> fetchCollection() {
        return fetchCollection(null, null);
    }

    public ComposableQuery<T, ID> fetchCollection(final String suffix) {
        return fetchCollection(suffix, null);
    }

    /**
     * Sample Code:
     * <pre>
     * memberCacheManager
     *     .fetchCollection("team_red", Criteria.where("team", "red"))
     *     .orderBy(Sort.by("age"))
     *     .list();
     * </pre>
     *
     * Only the {@code (suffix, criteria)} pair is cached. Operations chained on the returned query always run
     * against the data source.
     *
     * @see com.sporty.qcache.example.MemberController
     */
    public abstract ComposableQuery<T, ID> fetchCollection(final String suffix, final Criteria criteria);

    /**
     * Sample Code:
     * <pre>
     * memberCacheManager.fetchDetail(id, Criteria.where("id", id));
     * </pre>
     *
     * @throws QCacheNotFoundException with the configured error kind when no record matches
     * @see com.sporty.qcache.example.MemberController
     */
    public T fetchDetail(final Object identifier, final Criteria criteria) {
        return findDetail(identifier, criteria)
                .orElseThrow(() -> new QCacheNotFoundException(config.getNotFoundError(), detailCacheKey(identifier)));
    }

    /**
     * Same as {@link #fetchDetail(Object, Criteria)} but reports a missing record as empty.
     */
    public abstract Optional<T> findDetail(final Object identifier, final Criteria criteria);

    public abstract ID identifierOf(final T record);

    public abstract Class<ID> identifierType();

    /**
     * Removes the unsuffixed collection entry and every {@code {namespace}_*} entry.
     */
    public abstract void clearCache();

    public abstract void clearCollectionCache();

    /**
     * Removes every {@code {namespace}_*} entry, suffixed collections included.
     */
    public abstract void clearDetailCache();
}
