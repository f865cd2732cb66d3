package com.petwash.ledger.audit.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of {@code audit_ledger}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLedgerEntity {

    private String id;

    private String subjectId;

    private Long seq;

    private String eventType;

    /**
     * Canonical (key-sorted) JSON, exactly the text that went into the hash.
     */
    private String metadataJson;

    private String ipAddress;

    private String userAgent;

    /**
     * Signed timestamp as microseconds since the epoch.
     */
    private Long eventTsMicros;

    private String previousHash;

    private String recordHash;
}
