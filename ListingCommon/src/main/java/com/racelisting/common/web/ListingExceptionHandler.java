package com.racelisting.common.web;

import com.racelisting.common.exception.ListingNotFoundException;
import com.racelisting.common.exception.ListingQueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps listing errors to HTTP responses. Only a missing entity and a failed
 * store query ever reach the caller.
 */
@RestControllerAdvice
@Slf4j
public class ListingExceptionHandler {

    @ExceptionHandler(ListingNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ListingNotFoundException e) {
        log.debug("{} {} not found", e.getEntity(), e.getId());
        return build(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ListingQueryException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailure(ListingQueryException e) {
        log.error("Listing query failed: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
