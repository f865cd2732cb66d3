package com.petwash.ledger.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.petwash.ledger.audit.dto.AuditEvent;
import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Resolves the tail of a subject's chain and links new payloads to it. Reads the store every
 * time; callers serialize per subject and run resolve + insert in one transaction.
 */
@Service
@RequiredArgsConstructor
public class AuditChainService {
    private final AuditMapper mapper;
    private final ObjectMapper objectMapper;

    public String resolvePreviousHash(String subjectId) {
        return resolveTail(subjectId).hash();
    }

    public Tail resolveTail(String subjectId) {
        AuditLedgerEntity last = mapper.selectTail(subjectId);
        return last == null ? Tail.EMPTY : new Tail(last.getSeq(), last.getRecordHash());
    }

    /** Resolve the tail, then sign {@code event} on top of it. */
    public Link link(AuditEvent event, JsonNode metadata, Instant timestamp) {
        Tail tail = resolveTail(event.subjectId());
        String hash = AuditHasher.sign(objectMapper,
                event.eventType(), event.subjectId(), metadata,
                event.ipAddress(), event.userAgent(),
                timestamp, tail.hash());
        return new Link(tail.seq() + 1, tail.hash(), hash, timestamp);
    }

    public record Tail(long seq, String hash) {
        public static final Tail EMPTY = new Tail(0, null);
    }

    public record Link(long seq, String previousHash, String hash, Instant timestamp) {}
}
