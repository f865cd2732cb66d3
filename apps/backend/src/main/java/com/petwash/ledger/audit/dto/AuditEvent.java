package com.petwash.ledger.audit.dto;

import java.util.Map;

/**
 * What a producer hands to the ledger. {@code ipAddress} and {@code userAgent} are optional.
 */
public record AuditEvent(
        String eventType,
        String subjectId,
        Map<String, Object> metadata,
        String ipAddress,
        String userAgent
) {
    /** Chain identity for events that do not belong to a user. */
    public static final String SYSTEM_SUBJECT = "system";

    public static AuditEvent of(String eventType, String subjectId, Map<String, Object> metadata) {
        return new AuditEvent(eventType, subjectId, metadata, null, null);
    }

    /** Fills provenance fields the producer left empty; explicit values win. */
    public AuditEvent withProvenance(String fallbackIp, String fallbackUserAgent) {
        return new AuditEvent(eventType, subjectId, metadata,
                ipAddress != null ? ipAddress : fallbackIp,
                userAgent != null ? userAgent : fallbackUserAgent);
    }
}
