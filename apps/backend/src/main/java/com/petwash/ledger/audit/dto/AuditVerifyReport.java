package com.petwash.ledger.audit.dto;

import java.time.Instant;
import java.util.List;

public record AuditVerifyReport(
        String subjectId,
        boolean valid,
        int recordCount,
        List<String> brokenAt,     // ids of every flagged record, chain order
        List<AuditIssue> issues,
        String tailHash,           // hash of the last record, null for an empty chain
        boolean payloadChecked,
        Instant verifiedAt
) {}
