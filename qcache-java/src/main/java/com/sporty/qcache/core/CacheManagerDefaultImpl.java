package com.sporty.qcache.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sporty.qcache.exception.QCacheException;
import com.sporty.qcache.exception.QCacheSerializeException;
import com.sporty.qcache.source.ComposableQuery;
import com.sporty.qcache.source.Criteria;
import com.sporty.qcache.source.DataSource;
import com.sporty.qcache.store.CacheStore;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Log4j2
public class CacheManagerDefaultImpl<T, ID> extends CacheManager<T, ID> {
    private final DataSource<T, ID> dataSource;
    private final CacheStore cacheStore;
    private final JavaType identifierListType;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .registerModule(new JavaTimeModule());

    /**
     * Note:
     * <pre>
     * 1. A store that cannot be read is treated as a miss and the data source answers, so a Redis outage degrades to uncached reads.
     * 2. A result that cannot be written is still returned; the next call misses again.
     * 3. Concurrent misses on one key all query the data source and all write, the last write wins.
     * 4. Data source failures are never caught here.
     * 5. A miss returns the same identifier-scoped query a later hit rebuilds, so both see one record set in one order.
     * </pre>
     */
    public CacheManagerDefaultImpl(
            final CacheManagerConfig<T> config,
            final DataSource<T, ID> dataSource,
            final CacheStore cacheStore
    ) {
        super(config);

        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource is null");
        }
        if (dataSource.identifierType() == null) {
            throw new IllegalArgumentException("dataSource identifierType is null");
        }
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore is null");
        }

        this.dataSource = dataSource;
        this.cacheStore = cacheStore;
        this.identifierListType = objectMapper.getTypeFactory().constructCollectionType(List.class, dataSource.identifierType());
    }

    @Override
    public ComposableQuery<T, ID> fetchCollection(final String suffix, final Criteria criteria) {
        final String cacheKey = collectionCacheKey(suffix);
        final Criteria effectiveCriteria = criteria == null ? Criteria.empty() : criteria;
        if (suffix == null && !effectiveCriteria.isEmpty()) {
            log.warn("Caching a filtered collection without suffix under key: {}, it replaces the unfiltered collection", cacheKey);
        }

        final Optional<List<ID>> cachedIdentifiers = readCollectionIdentifiers(cacheKey);
        if (cachedIdentifiers.isPresent()) {
            log.debug("Cache hit for collection key: {}", cacheKey);
            return dataSource
                    .query(Criteria.empty(), config.listEagerLoad())
                    .byIdentifiers(cachedIdentifiers.get());
        }

        final List<ID> identifiers = dataSource
                .query(effectiveCriteria, config.listEagerLoad())
                .values(dataSource::identifierOf);
        final CachedCollectionEntry entry = new CachedCollectionEntry(suffix, effectiveCriteria.conditions(), identifiers);
        if (writeEntry(cacheKey, entry, config.getListTimeout())) {
            log.info("Cached {} identifiers from data source for collection key: {}", identifiers.size(), cacheKey);
        }

        return dataSource
                .query(Criteria.empty(), config.listEagerLoad())
                .byIdentifiers(identifiers);
    }

    @Override
    public Optional<T> findDetail(final Object identifier, final Criteria criteria) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier is null");
        }
        if (criteria == null) {
            throw new IllegalArgumentException("criteria is null");
        }

        final String cacheKey = detailCacheKey(identifier);

        final Optional<T> cachedRecord = readDetail(cacheKey);
        if (cachedRecord.isPresent()) {
            if (stillExists(cachedRecord.get())) {
                log.debug("Cache hit for detail key: {}", cacheKey);
                return cachedRecord;
            }

            log.info("Cached record for key: {} no longer exists in data source, evicting", cacheKey);
            evictSilently(cacheKey);
            return Optional.empty();
        }

        final Optional<T> record = dataSource.queryOne(criteria, config.detailEagerLoad());
        if (record.isEmpty()) {
            log.info("Data source has no record for detail key: {}", cacheKey);
            return Optional.empty();
        }

        if (writeEntry(cacheKey, record.get(), config.getDetailTimeout())) {
            log.info("Cached record from data source for detail key: {}", cacheKey);
        }

        return record;
    }

    @Override
    public ID identifierOf(final T record) {
        return dataSource.identifierOf(record);
    }

    @Override
    public Class<ID> identifierType() {
        return dataSource.identifierType();
    }

    @Override
    public void clearCache() {
        clearCollectionCache();
        clearDetailCache();
    }

    @Override
    public void clearCollectionCache() {
        cacheStore.delete(cacheKeyNamespace());
    }

    @Override
    public void clearDetailCache() {
        final Set<String> cacheKeys = cacheStore.keys(CacheKeys.detailKeyPattern(cacheKeyNamespace()));
        cacheStore.deleteAll(cacheKeys);
        log.info("Cleared {} entries under namespace: {}", cacheKeys.size(), cacheKeyNamespace());
    }

    private boolean stillExists(final T cachedRecord) {
        final ID identifier = dataSource.identifierOf(cachedRecord);
        if (identifier == null) {
            return false;
        }
        return dataSource
                .query(Criteria.empty(), List.of())
                .byIdentifiers(List.of(identifier))
                .exists();
    }

    private Optional<List<ID>> readCollectionIdentifiers(final String cacheKey) {
        try {
            final Optional<String> json = cacheStore.get(cacheKey);
            if (json.isEmpty() || json.get().isBlank()) {
                return Optional.empty();
            }

            final CachedCollectionEntry entry = readJson(cacheKey, json.get(), objectMapper.constructType(CachedCollectionEntry.class));
            final List<ID> identifiers = entry.getIdentifiers() == null
                    ? List.of()
                    : convertIdentifiers(cacheKey, entry.getIdentifiers());
            return Optional.of(identifiers);
        } catch (QCacheException e) {
            log.error("Failed to read collection entry for key: {}, falling back to data source", cacheKey, e);
            return Optional.empty();
        }
    }

    private Optional<T> readDetail(final String cacheKey) {
        try {
            final Optional<String> json = cacheStore.get(cacheKey);
            if (json.isEmpty() || json.get().isBlank()) {
                return Optional.empty();
            }

            return Optional.of(readJson(cacheKey, json.get(), objectMapper.constructType(config.getModel())));
        } catch (QCacheException e) {
            log.error("Failed to read detail entry for key: {}, falling back to data source", cacheKey, e);
            return Optional.empty();
        }
    }

    private boolean writeEntry(final String cacheKey, final Object entry, final Duration ttl) {
        try {
            cacheStore.set(cacheKey, writeJson(cacheKey, entry), ttl);
            return true;
        } catch (QCacheException e) {
            log.error("Failed to write entry for key: {}, returning uncached result", cacheKey, e);
            return false;
        }
    }

    private void evictSilently(final String cacheKey) {
        try {
            cacheStore.delete(cacheKey);
        } catch (QCacheException e) {
            log.error("Failed to evict stale entry for key: {}, it stays until it expires", cacheKey, e);
        }
    }

    private List<ID> convertIdentifiers(final String cacheKey, final List<?> identifiers) throws QCacheSerializeException {
        try {
            return objectMapper.convertValue(identifiers, identifierListType);
        } catch (IllegalArgumentException e) {
            throw new QCacheSerializeException("Failed to convert cached identifiers for key: " + cacheKey, e);
        }
    }

    private String writeJson(final String cacheKey, final Object entry) throws QCacheSerializeException {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (Exception e) {
            throw new QCacheSerializeException("Failed to serialize cache payload for key: " + cacheKey, e);
        }
    }

    private <E> E readJson(final String cacheKey, final String json, final JavaType type) throws QCacheSerializeException {
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            throw new QCacheSerializeException("Failed to deserialize cache payload for key: " + cacheKey, e);
        }
    }
}
