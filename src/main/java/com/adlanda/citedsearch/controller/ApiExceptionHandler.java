package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.exception.CitedSearchException;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.IngestionInProgressException;
import com.adlanda.citedsearch.exception.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to HTTP responses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Map<String, String>> handleInvalidQuery(QueryValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IngestionInProgressException.class)
    public ResponseEntity<Map<String, String>> handleIngestionInProgress(IngestionInProgressException e) {
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(CollaboratorTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(CollaboratorTimeoutException e) {
        log.warn("Request failed: {}", e.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    /**
     * Embedding, index and generation failures.
     */
    @ExceptionHandler(CitedSearchException.class)
    public ResponseEntity<Map<String, String>> handleCollaboratorFailure(CitedSearchException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return body(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", status.getReasonPhrase(),
                "message", message != null ? message : ""
        ));
    }
}
