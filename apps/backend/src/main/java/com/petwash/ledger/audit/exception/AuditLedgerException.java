package com.petwash.ledger.audit.exception;

public class AuditLedgerException extends RuntimeException {

    public AuditLedgerException(String message) {
        super(message);
    }

    public AuditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
