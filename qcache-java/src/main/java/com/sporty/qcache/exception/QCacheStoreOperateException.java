package com.sporty.qcache.exception;

public class QCacheStoreOperateException extends QCacheException {
    public QCacheStoreOperateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
