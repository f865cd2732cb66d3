package com.petwash.ledger.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.petwash.ledger.audit.dto.AuditEvent;
import com.petwash.ledger.audit.dto.AuditRecord;
import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import com.petwash.ledger.audit.exception.AuditConcurrencyConflictException;
import com.petwash.ledger.audit.exception.AuditPersistenceException;
import com.petwash.ledger.audit.exception.AuditValidationException;
import com.petwash.ledger.audit.support.SubjectLockRegistry;
import com.petwash.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appends events to their subject's chain.
 *
 * <p>Per append: validate, take the subject lock, then in one transaction capture the timestamp,
 * resolve the tail, sign and insert. A duplicate key on insert means another writer got there
 * first; the whole attempt is redone against the new tail, up to
 * {@link LedgerProperties#getMaxAppendAttempts()} times. Other storage failures are not retried.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLedgerService {

    static final int MAX_IP_LENGTH = 64;
    static final int MAX_USER_AGENT_LENGTH = 512;

    private static final TypeReference<Map<String, Object>> MAP_TYPE =
            new TypeReference<Map<String, Object>>() {};

    private final AuditMapper mapper;
    private final AuditChainService chainService;
    private final SubjectLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerProperties props;
    private final Clock clock;

    public AuditRecord append(String eventType, String subjectId, Map<String, Object> metadata,
                              String ipAddress, String userAgent) {
        return append(new AuditEvent(eventType, subjectId, metadata, ipAddress, userAgent));
    }

    public AuditRecord append(AuditEvent event) {
        validate(event);
        JsonNode metadata = AuditHasher.normalizeMetadata(objectMapper, event.metadata());
        String metadataJson = AuditHasher.canonicalize(objectMapper, metadata);
        int maxAttempts = Math.max(1, props.getMaxAppendAttempts());

        try (SubjectLockRegistry.SubjectLock ignored = locks.acquire(event.subjectId(), props.getLockTimeout())) {
            for (int attempt = 1; ; attempt++) {
                try {
                    AuditLedgerEntity row = insertOnce(event, metadata, metadataJson);
                    log.debug("Appended audit record id={} subject={} seq={} type={}",
                            row.getId(), row.getSubjectId(), row.getSeq(), row.getEventType());
                    return toRecord(row, metadata);
                } catch (AuditConcurrencyConflictException ex) {
                    if (attempt >= maxAttempts) {
                        log.warn("Giving up append subject={} type={} after {} attempt(s)",
                                event.subjectId(), event.eventType(), attempt);
                        throw ex;
                    }
                    log.warn("Chain of subject={} moved during append (attempt {}/{}), re-resolving tail",
                            event.subjectId(), attempt, maxAttempts);
                }
            }
        }
    }

    /** Most recent records of a subject, newest first. */
    public List<AuditRecord> trail(String subjectId, Integer limit) {
        requireSubject(subjectId);
        int max = Math.max(1, props.getTrailMaxLimit());
        int effective = limit == null ? props.getTrailDefaultLimit() : limit;
        effective = Math.min(Math.max(1, effective), max);

        List<AuditLedgerEntity> rows;
        try {
            rows = mapper.selectRecent(subjectId, effective);
        } catch (DataAccessException ex) {
            throw new AuditPersistenceException("Failed to read audit trail of subject " + subjectId, ex);
        }
        List<AuditRecord> out = new ArrayList<>(rows.size());
        for (AuditLedgerEntity row : rows) {
            out.add(toRecord(row));
        }
        return out;
    }

    public AuditRecord toRecord(AuditLedgerEntity row) {
        JsonNode metadata = AuditHasher.readStoredMetadata(objectMapper, row.getMetadataJson()).orElse(null);
        if (metadata == null) {
            log.warn("Stored metadata of audit record id={} subject={} is not readable JSON",
                    row.getId(), row.getSubjectId());
        }
        return toRecord(row, metadata);
    }

    private AuditLedgerEntity insertOnce(AuditEvent event, JsonNode metadata, String metadataJson) {
        try {
            return transactionTemplate.execute(status -> {
                Instant timestamp = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
                AuditChainService.Link link = chainService.link(event, metadata, timestamp);

                AuditLedgerEntity row = AuditLedgerEntity.builder()
                        .id(UUID.randomUUID().toString())
                        .subjectId(event.subjectId())
                        .seq(link.seq())
                        .eventType(event.eventType())
                        .metadataJson(metadataJson)
                        .ipAddress(event.ipAddress())
                        .userAgent(event.userAgent())
                        .eventTsMicros(AuditHasher.toEpochMicros(timestamp))
                        .previousHash(link.previousHash())
                        .recordHash(link.hash())
                        .build();
                mapper.insert(row);
                return row;
            });
        } catch (DuplicateKeyException ex) {
            throw new AuditConcurrencyConflictException(event.subjectId(),
                    "Chain of subject " + event.subjectId() + " was extended concurrently", ex);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to persist audit event subject={} type={}",
                    event.subjectId(), event.eventType(), ex);
            throw new AuditPersistenceException(
                    "Audit event for subject " + event.subjectId() + " was not recorded", ex);
        }
    }

    private void validate(AuditEvent event) {
        if (event == null) {
            throw new AuditValidationException("event is required");
        }
        requireSubject(event.subjectId());
        if (!StringUtils.hasText(event.eventType())) {
            throw new AuditValidationException("eventType is required");
        }
        if (event.eventType().length() > props.getMaxEventTypeLength()) {
            throw new AuditValidationException("eventType exceeds " + props.getMaxEventTypeLength() + " characters");
        }
        if (event.ipAddress() != null && event.ipAddress().length() > MAX_IP_LENGTH) {
            throw new AuditValidationException("ipAddress exceeds " + MAX_IP_LENGTH + " characters");
        }
        if (event.userAgent() != null && event.userAgent().length() > MAX_USER_AGENT_LENGTH) {
            throw new AuditValidationException("userAgent exceeds " + MAX_USER_AGENT_LENGTH + " characters");
        }
    }

    private void requireSubject(String subjectId) {
        if (!StringUtils.hasText(subjectId)) {
            throw new AuditValidationException("subjectId is required");
        }
        if (subjectId.length() > props.getMaxSubjectIdLength()) {
            throw new AuditValidationException("subjectId exceeds " + props.getMaxSubjectIdLength() + " characters");
        }
    }

    private AuditRecord toRecord(AuditLedgerEntity row, JsonNode metadata) {
        Map<String, Object> meta = metadata == null || !metadata.isObject()
                ? null : objectMapper.convertValue(metadata, MAP_TYPE);
        return new AuditRecord(
                row.getId(),
                row.getSubjectId(),
                row.getSeq(),
                row.getEventType(),
                meta,
                row.getIpAddress(),
                row.getUserAgent(),
                AuditHasher.fromEpochMicros(row.getEventTsMicros()),
                row.getPreviousHash(),
                row.getRecordHash());
    }
}
