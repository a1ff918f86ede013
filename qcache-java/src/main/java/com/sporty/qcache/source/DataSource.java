package com.sporty.qcache.source;

import java.util.List;
import java.util.Optional;

/**
 * Query entry point of the record store sitting behind a {@link com.sporty.qcache.core.CacheManager}.
 * <p>
 * {@code eagerLoad} lists the related fields that should be loaded in the same round trip as the records.
 * Failures are reported with unchecked exceptions, usually Spring's {@code DataAccessException} hierarchy,
 * and are never caught by the cache.
 *
 * @param <T>  record type
 * @param <ID> identifier type of the record
 */
public interface DataSource<T, ID> {
    ComposableQuery<T, ID> query(final Criteria criteria, final List<String> eagerLoad);

    /**
     * @return the only record matching {@code criteria}, or empty when none does
     * @throws org.springframework.dao.IncorrectResultSizeDataAccessException when more than one record matches
     */
    Optional<T> queryOne(final Criteria criteria, final List<String> eagerLoad);

    ID identifierOf(final T record);

    Class<ID> identifierType();
}
