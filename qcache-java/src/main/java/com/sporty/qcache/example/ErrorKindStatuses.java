package com.sporty.qcache.example;

import com.sporty.qcache.exception.ErrorKind;
import org.springframework.http.HttpStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * HTTP status each {@link ErrorKind} is answered with. Kinds without a mapping fall back to 404.
 */
public class ErrorKindStatuses {
    private final Map<ErrorKind, HttpStatus> statuses;

    public ErrorKindStatuses(final Map<ErrorKind, HttpStatus> statuses) {
        this.statuses = statuses.isEmpty() ? new EnumMap<>(ErrorKind.class) : new EnumMap<>(statuses);
    }

    public HttpStatus statusOf(final ErrorKind kind) {
        return statuses.getOrDefault(kind, HttpStatus.NOT_FOUND);
    }
}
