package com.petwash.ledger.audit.exception;

import lombok.Getter;

/**
 * Another writer extended the same chain first. Safe to retry; the retry must re-resolve the tail.
 */
@Getter
public class AuditConcurrencyConflictException extends AuditLedgerException {

    private final String subjectId;

    public AuditConcurrencyConflictException(String subjectId, String message) {
        super(message);
        this.subjectId = subjectId;
    }

    public AuditConcurrencyConflictException(String subjectId, String message, Throwable cause) {
        super(message, cause);
        this.subjectId = subjectId;
    }
}
