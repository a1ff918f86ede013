package com.sporty.qcache.exception;

public class QCacheException extends RuntimeException {
    public QCacheException(final String message) {
        super(message);
    }

    public QCacheException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
