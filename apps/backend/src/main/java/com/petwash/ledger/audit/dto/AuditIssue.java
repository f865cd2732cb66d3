package com.petwash.ledger.audit.dto;

public record AuditIssue(
        int index,          // position in the replayed chain, from 0
        String recordId,
        long seq,
        Reason reason,
        String expected,
        String actual
) {
    public enum Reason {
        /** previousHash differs from the predecessor's stored hash. */
        LINK_MISMATCH,
        /** The first record of a chain points at a predecessor. */
        GENESIS_LINKED,
        /** seq does not follow the predecessor's seq by exactly one. */
        SEQUENCE_GAP,
        /** Re-signing the stored fields does not reproduce the stored hash. */
        PAYLOAD_MISMATCH,
        /** Stored metadata is not readable JSON. */
        UNREADABLE_PAYLOAD
    }
}
