package com.sporty.qcache.exception;

public class QCacheSerializeException extends QCacheException {
    public QCacheSerializeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
