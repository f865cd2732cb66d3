package com.petwash.ledger.audit;

import com.petwash.ledger.audit.dto.AuditVerifyReport;
import com.petwash.ledger.audit.exception.AuditPersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodically verifies every chain in the ledger and publishes a
 * {@link ChainIntegrityViolationEvent} for each broken one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.audit.sweep", name = "enabled", havingValue = "true")
public class AuditIntegritySweeper {

    private final AuditMapper auditMapper;
    private final AuditVerifyService verifyService;
    private final ApplicationEventPublisher publisher;

    @Scheduled(cron = "${ledger.audit.sweep.cron:0 0 3 * * *}")
    public void scheduledSweep() {
        sweep();
    }

    /** @return the reports of broken chains */
    public List<AuditVerifyReport> sweep() {
        List<String> subjects = auditMapper.selectSubjects();
        log.info("Audit integrity sweep started, {} subject(s)", subjects.size());

        List<AuditVerifyReport> broken = new ArrayList<>();
        long records = 0;
        int failed = 0;
        for (String subjectId : subjects) {
            AuditVerifyReport report;
            try {
                report = verifyService.verify(subjectId);
            } catch (AuditPersistenceException ex) {
                failed++;
                log.error("Audit integrity sweep could not load subject={}", subjectId, ex);
                continue;
            }
            records += report.recordCount();
            if (!report.valid()) {
                broken.add(report);
                publisher.publishEvent(new ChainIntegrityViolationEvent(report));
            }
        }

        log.info("Audit integrity sweep finished: subjects={} records={} broken={} unreadable={}",
                subjects.size(), records, broken.size(), failed);
        return broken;
    }
}
