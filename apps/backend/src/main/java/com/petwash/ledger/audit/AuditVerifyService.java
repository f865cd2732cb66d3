package com.petwash.ledger.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.petwash.ledger.audit.dto.AuditIssue;
import com.petwash.ledger.audit.dto.AuditVerifyReport;
import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import com.petwash.ledger.audit.exception.AuditPersistenceException;
import com.petwash.ledger.audit.exception.AuditValidationException;
import com.petwash.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Replays a subject's chain in seq order and reports every finding:
 * <ul>
 *   <li>link: {@code previousHash} must equal the predecessor's stored {@code hash}
 *       (the first record must have none), and seq must advance by one;</li>
 *   <li>payload (optional): re-signing the stored fields must reproduce the stored {@code hash}.</li>
 * </ul>
 * Stored hashes are the ground truth for linkage, so one altered record does not cascade into
 * findings on its successors. Nothing is ever written back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditVerifyService {

    private final AuditMapper auditMapper;
    private final ObjectMapper objectMapper;
    private final LedgerProperties props;
    private final Clock clock;

    public AuditVerifyReport verify(String subjectId) {
        return verify(subjectId, props.isVerifyPayload());
    }

    public AuditVerifyReport verify(String subjectId, boolean checkPayload) {
        if (!StringUtils.hasText(subjectId)) {
            throw new AuditValidationException("subjectId is required");
        }
        List<AuditLedgerEntity> chain = fetchChain(subjectId);
        AuditVerifyReport report = verifyChain(subjectId, chain, checkPayload);
        if (report.valid()) {
            log.debug("Audit chain subject={} intact, {} record(s)", subjectId, report.recordCount());
        } else {
            log.warn("Audit chain subject={} broken at {} record(s) of {}",
                    subjectId, report.brokenAt().size(), report.recordCount());
        }
        return report;
    }

    /** Shared with the exporter so both read the same ordering. */
    public List<AuditLedgerEntity> fetchChain(String subjectId) {
        try {
            return auditMapper.selectChain(subjectId);
        } catch (DataAccessException ex) {
            throw new AuditPersistenceException("Failed to load audit chain of subject " + subjectId, ex);
        }
    }

    AuditVerifyReport verifyChain(String subjectId, List<AuditLedgerEntity> rows, boolean checkPayload) {
        List<AuditIssue> issues = new ArrayList<>();
        Set<String> brokenAt = new LinkedHashSet<>();
        AuditLedgerEntity prev = null;

        for (int i = 0; i < rows.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Verification of subject " + subjectId + " cancelled at index " + i);
            }
            AuditLedgerEntity r = rows.get(i);
            long seq = r.getSeq() == null ? -1 : r.getSeq();

            if (prev == null) {
                if (r.getPreviousHash() != null) {
                    issues.add(issue(i, r, AuditIssue.Reason.GENESIS_LINKED, null, r.getPreviousHash()));
                }
                if (seq != 1) {
                    issues.add(issue(i, r, AuditIssue.Reason.SEQUENCE_GAP, "1", String.valueOf(seq)));
                }
            } else {
                if (!Objects.equals(r.getPreviousHash(), prev.getRecordHash())) {
                    issues.add(issue(i, r, AuditIssue.Reason.LINK_MISMATCH, prev.getRecordHash(), r.getPreviousHash()));
                }
                long expectedSeq = (prev.getSeq() == null ? -1 : prev.getSeq()) + 1;
                if (seq != expectedSeq) {
                    issues.add(issue(i, r, AuditIssue.Reason.SEQUENCE_GAP, String.valueOf(expectedSeq), String.valueOf(seq)));
                }
            }

            if (checkPayload) {
                checkPayload(i, r).ifPresent(issues::add);
            }
            prev = r;
        }

        for (AuditIssue issue : issues) {
            brokenAt.add(issue.recordId());
        }
        String tail = prev == null ? null : prev.getRecordHash();
        return new AuditVerifyReport(subjectId, issues.isEmpty(), rows.size(),
                List.copyOf(brokenAt), List.copyOf(issues), tail, checkPayload, Instant.now(clock));
    }

    private Optional<AuditIssue> checkPayload(int index, AuditLedgerEntity r) {
        Optional<JsonNode> metadata = AuditHasher.readStoredMetadata(objectMapper, r.getMetadataJson());
        if (metadata.isEmpty() || r.getEventTsMicros() == null) {
            return Optional.of(issue(index, r, AuditIssue.Reason.UNREADABLE_PAYLOAD, null, r.getMetadataJson()));
        }
        String expected = AuditHasher.sign(objectMapper,
                r.getEventType(), r.getSubjectId(), metadata.get(),
                r.getIpAddress(), r.getUserAgent(),
                AuditHasher.fromEpochMicros(r.getEventTsMicros()), r.getPreviousHash());
        if (!expected.equals(r.getRecordHash())) {
            return Optional.of(issue(index, r, AuditIssue.Reason.PAYLOAD_MISMATCH, expected, r.getRecordHash()));
        }
        return Optional.empty();
    }

    private static AuditIssue issue(int index, AuditLedgerEntity r, AuditIssue.Reason reason,
                                    String expected, String actual) {
        return new AuditIssue(index, r.getId(), r.getSeq() == null ? -1 : r.getSeq(), reason, expected, actual);
    }
}
