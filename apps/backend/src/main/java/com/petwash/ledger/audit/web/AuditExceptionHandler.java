package com.petwash.ledger.audit.web;

import com.petwash.ledger.audit.exception.AuditConcurrencyConflictException;
import com.petwash.ledger.audit.exception.AuditPersistenceException;
import com.petwash.ledger.audit.exception.AuditValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps ledger failures to HTTP. Validation is the producer's fault (400), a lost race is
 * retryable (409), a storage failure means the event was not recorded (503).
 */
@RestControllerAdvice
@Slf4j
public class AuditExceptionHandler {

    @ExceptionHandler(AuditValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(AuditValidationException ex, ServerWebExchange exchange) {
        log.warn("Rejected audit request on {}: {}", path(exchange), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), exchange);
    }

    @ExceptionHandler(AuditConcurrencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(AuditConcurrencyConflictException ex, ServerWebExchange exchange) {
        log.warn("Concurrent append conflict subject={} on {}", ex.getSubjectId(), path(exchange));
        return respond(HttpStatus.CONFLICT, "Concurrent Append",
                "The chain was extended by another writer. Please retry.", exchange);
    }

    @ExceptionHandler(AuditPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(AuditPersistenceException ex, ServerWebExchange exchange) {
        log.error("Audit storage failure on {}", path(exchange), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
                "The audit event was not recorded.", exchange);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         ServerWebExchange exchange) {
        ErrorResponse body = new ErrorResponse(
                UUID.randomUUID().toString(),
                Instant.now(),
                status.value(),
                error,
                message,
                path(exchange));
        return ResponseEntity.status(status).body(body);
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
