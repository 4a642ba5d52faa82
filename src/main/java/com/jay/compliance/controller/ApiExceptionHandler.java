package com.jay.compliance.controller;

import com.jay.compliance.layer2_sources.NotFoundException;
import com.jay.compliance.layer2_sources.RateLimitedException;
import com.jay.compliance.layer2_sources.SourceTimeoutException;
import com.jay.compliance.layer2_sources.UpstreamException;
import com.jay.compliance.layer4_orchestrator.UnsupportedCountryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps exceptions to JSON error bodies. Messages of upstream failures are not
 * echoed back; they may contain registry response text.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, UnsupportedCountryException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed request");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "company not found");
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> upstreamRateLimited(RateLimitedException ex) {
        log.warn("Upstream {} rate limited the request", ex.getSource());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "upstream rate limited, retry later");
    }

    @ExceptionHandler(SourceTimeoutException.class)
    public ResponseEntity<Map<String, Object>> timeout(SourceTimeoutException ex) {
        log.warn("Upstream {} timed out", ex.getSource());
        return error(HttpStatus.GATEWAY_TIMEOUT, "upstream timeout");
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> upstream(UpstreamException ex) {
        log.warn("Upstream {} failed with code {}", ex.getSource(), ex.getCode());
        HttpStatus status = ex.getCode() == 503 ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return error(status, "upstream error");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "error", message == null ? status.getReasonPhrase() : message,
            "status", status.value()
        ));
    }
}
