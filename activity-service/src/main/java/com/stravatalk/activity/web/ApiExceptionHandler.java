package com.stravatalk.activity.web;

import com.stravatalk.activity.error.AuthorizationException;
import com.stravatalk.activity.error.DatabaseException;
import com.stravatalk.activity.error.OperationTimeoutException;
import com.stravatalk.activity.error.SqlValidationException;
import com.stravatalk.activity.error.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Status mapping for exceptions that controllers let through.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({SqlValidationException.class, IllegalArgumentException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<Map<String, String>> unauthorized(AuthorizationException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, String>> upstream(UpstreamException e) {
        log.error("Strava request failed ({}): {}", e.getStatus(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<Map<String, String>> timeout(OperationTimeoutException e) {
        log.error("Operation timed out: {}", e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    @ExceptionHandler({DatabaseException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, String>> internal(RuntimeException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
