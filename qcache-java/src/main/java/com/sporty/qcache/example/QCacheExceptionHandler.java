package com.sporty.qcache.example;

import com.sporty.qcache.exception.QCacheNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class QCacheExceptionHandler {
    private final ErrorKindStatuses errorKindStatuses;

    @ExceptionHandler(QCacheNotFoundException.class)
    public ResponseEntity<Void> handleNotFound(final QCacheNotFoundException e) {
        log.debug(e.getMessage());
        return ResponseEntity.status(errorKindStatuses.statusOf(e.getKind())).build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(final IllegalArgumentException e) {
        log.warn(e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
