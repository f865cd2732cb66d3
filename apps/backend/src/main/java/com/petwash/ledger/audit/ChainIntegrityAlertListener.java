package com.petwash.ledger.audit;

import com.petwash.ledger.audit.dto.AuditIssue;
import com.petwash.ledger.audit.dto.AuditVerifyReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Surfaces integrity findings to operators through the log.
 */
@Slf4j
@Component
public class ChainIntegrityAlertListener {

    @EventListener(ChainIntegrityViolationEvent.class)
    public void onViolation(ChainIntegrityViolationEvent ev) {
        AuditVerifyReport report = ev.report();
        log.error("[AUDIT-INTEGRITY] subject={} records={} broken={} verifiedAt={}",
                report.subjectId(), report.recordCount(), report.brokenAt(), report.verifiedAt());
        for (AuditIssue issue : report.issues()) {
            log.error("[AUDIT-INTEGRITY]   #{} id={} seq={} reason={} expected={} actual={}",
                    issue.index(), issue.recordId(), issue.seq(), issue.reason(), issue.expected(), issue.actual());
        }
    }
}
