package com.petwash.ledger.audit.exception;

/**
 * Malformed event. Nothing was hashed or written; the producer has to fix the payload.
 */
public class AuditValidationException extends AuditLedgerException {

    public AuditValidationException(String message) {
        super(message);
    }

    public AuditValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
