package com.petwash.ledger.audit.dto;

import java.time.Instant;
import java.util.Map;

public record AuditRecord(
        String id,
        String subjectId,
        long seq,              // 1-based position in the subject's chain
        String eventType,
        Map<String, Object> metadata,
        String ipAddress,
        String userAgent,
        Instant timestamp,     // the exact instant that was hashed
        String previousHash,   // null for the first record of a chain
        String hash
) {}
