package com.sporty.qcache.exception;

/**
 * Kind of failure reported when a detail fetch finds nothing.
 * <p>
 * The core never translates a kind into a transport status; the integrating application maps it at its boundary.
 *
 * @see com.sporty.qcache.example.QCacheExceptionHandler
 */
public enum ErrorKind {
    NOT_FOUND,
    GONE,
    FORBIDDEN
}
