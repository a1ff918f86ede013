package com.sporty.qcache.exception;

import lombok.Getter;

@Getter
public class QCacheNotFoundException extends QCacheException {
    private final ErrorKind kind;
    private final String cacheKey;

    public QCacheNotFoundException(final ErrorKind kind, final String cacheKey) {
        super("No record found for key: " + cacheKey);
        this.kind = kind;
        this.cacheKey = cacheKey;
    }
}
