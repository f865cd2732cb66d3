package com.petwash.ledger.audit;

import com.petwash.ledger.audit.dto.AuditVerifyReport;
import org.springframework.context.ApplicationEvent;

/**
 * A verification run found a broken chain. Informational; nothing reacts by changing records.
 */
public class ChainIntegrityViolationEvent extends ApplicationEvent {
    public ChainIntegrityViolationEvent(AuditVerifyReport report) { super(report); }
    public AuditVerifyReport report() { return (AuditVerifyReport) getSource(); }
}
