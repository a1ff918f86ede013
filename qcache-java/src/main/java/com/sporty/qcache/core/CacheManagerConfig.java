package com.sporty.qcache.core;

import com.sporty.qcache.exception.ErrorKind;
import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable per record type settings of a {@link CacheManager}.
 * <p>
 * Sample Code:
 * <pre>
 * CacheManagerConfig
 *         .builder(Member.class)
 *         .cacheKey("member")
 *         .relatedObjects(List.of("team"))
 *         .prefetchRelatedObjects(List.of("tags"))
 *         .listTimeout(Duration.ofDays(1))
 *         .detailTimeout(Duration.ofMinutes(1))
 *         .build();
 * </pre>
 */
@Getter
public final class CacheManagerConfig<T> {
    public static final Duration DEFAULT_LIST_TIMEOUT = Duration.ofDays(1);
    public static final Duration DEFAULT_DETAIL_TIMEOUT = Duration.ofMinutes(1);

    private final Class<T> model;
    private final String cacheKey;
    private final List<String> relatedObjects;
    private final List<String> prefetchRelatedObjects;
    private final boolean usePrefetchForList;
    private final Duration listTimeout;
    private final Duration detailTimeout;
    private final ErrorKind notFoundError;

    private CacheManagerConfig(final Builder<T> builder) {
        this.model = builder.model;
        this.cacheKey = builder.cacheKey;
        this.relatedObjects = builder.relatedObjects == null ? null : List.copyOf(builder.relatedObjects);
        this.prefetchRelatedObjects = builder.prefetchRelatedObjects == null ? null : List.copyOf(builder.prefetchRelatedObjects);
        this.usePrefetchForList = builder.usePrefetchForList;
        this.listTimeout = builder.listTimeout;
        this.detailTimeout = builder.detailTimeout;
        this.notFoundError = builder.notFoundError;
    }

    public static <T> Builder<T> builder(final Class<T> model) {
        return new Builder<>(model);
    }

    /**
     * The configured cache key, or the lowercase simple name of the model.
     */
    public String namespace() {
        return cacheKey != null ? cacheKey : model.getSimpleName().toLowerCase(Locale.ROOT);
    }

    List<String> listEagerLoad() {
        return union(relatedObjects, usePrefetchForList ? prefetchRelatedObjects : null);
    }

    List<String> detailEagerLoad() {
        return union(relatedObjects, prefetchRelatedObjects);
    }

    private static List<String> union(final List<String> first, final List<String> second) {
        final Set<String> fields = new LinkedHashSet<>();
        if (first != null) {
            fields.addAll(first);
        }
        if (second != null) {
            fields.addAll(second);
        }
        return List.copyOf(fields);
    }

    public static final class Builder<T> {
        private final Class<T> model;
        private String cacheKey;
        private List<String> relatedObjects;
        private List<String> prefetchRelatedObjects;
        private boolean usePrefetchForList = true;
        private Duration listTimeout = DEFAULT_LIST_TIMEOUT;
        private Duration detailTimeout = DEFAULT_DETAIL_TIMEOUT;
        private ErrorKind notFoundError = ErrorKind.NOT_FOUND;

        private Builder(final Class<T> model) {
            this.model = model;
        }

        public Builder<T> cacheKey(final String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder<T> relatedObjects(final List<String> relatedObjects) {
            this.relatedObjects = relatedObjects;
            return this;
        }

        public Builder<T> prefetchRelatedObjects(final List<String> prefetchRelatedObjects) {
            this.prefetchRelatedObjects = prefetchRelatedObjects;
            return this;
        }

        public Builder<T> usePrefetchForList(final boolean usePrefetchForList) {
            this.usePrefetchForList = usePrefetchForList;
            return this;
        }

        public Builder<T> listTimeout(final Duration listTimeout) {
            this.listTimeout = listTimeout;
            return this;
        }

        public Builder<T> detailTimeout(final Duration detailTimeout) {
            this.detailTimeout = detailTimeout;
            return this;
        }

        public Builder<T> notFoundError(final ErrorKind notFoundError) {
            this.notFoundError = notFoundError;
            return this;
        }

        public CacheManagerConfig<T> build() {
            if (model == null) {
                throw new IllegalArgumentException("model is null");
            }
            if (cacheKey != null && cacheKey.isBlank()) {
                throw new IllegalArgumentException("cacheKey is blank");
            }
            if (relatedObjects != null && relatedObjects.contains(null)) {
                throw new IllegalArgumentException("relatedObjects contains null");
            }
            if (prefetchRelatedObjects != null && prefetchRelatedObjects.contains(null)) {
                throw new IllegalArgumentException("prefetchRelatedObjects contains null");
            }
            if (isInvalid(listTimeout)) {
                throw new IllegalArgumentException("listTimeout is null or invalid");
            }
            if (isInvalid(detailTimeout)) {
                throw new IllegalArgumentException("detailTimeout is null or invalid");
            }
            if (notFoundError == null) {
                throw new IllegalArgumentException("notFoundError is null");
            }
            return new CacheManagerConfig<>(this);
        }

        private static boolean isInvalid(final Duration timeout) {
            return timeout == null || timeout.isZero() || timeout.isNegative();
        }
    }
}
