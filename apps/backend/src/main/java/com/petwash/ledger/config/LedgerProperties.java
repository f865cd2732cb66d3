package com.petwash.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code ledger.audit.*}. The integrity sweep reads {@code ledger.audit.sweep.*}
 * itself, see {@link com.petwash.ledger.audit.AuditIntegritySweeper}.
 */
@Data
@ConfigurationProperties(prefix = "ledger.audit")
public class LedgerProperties {

    /** Attempts per append when another writer extends the same chain first. */
    private int maxAppendAttempts = 3;

    /** How long an append waits for the subject's lock. */
    private Duration lockTimeout = Duration.ofSeconds(5);

    /** Re-sign every record during verification, not only check links. */
    private boolean verifyPayload = true;

    private int maxSubjectIdLength = 128;
    private int maxEventTypeLength = 128;

    private int trailDefaultLimit = 100;
    private int trailMaxLimit = 1000;
}
