package com.petwash.ledger.audit.exception;

/**
 * The store failed or rejected the write. The event is not recorded.
 */
public class AuditPersistenceException extends AuditLedgerException {

    public AuditPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
