package com.z254.lazarus.audit;

/**
 * Result of walking the audit chain and recomputing every hash.
 *
 * @param firstInvalidSequence sequence number of the first broken entry, {@code null} when valid
 */
public record AuditChainVerification(
        boolean valid,
        long entriesChecked,
        Long firstInvalidSequence,
        String reason
) {

    public static AuditChainVerification ok(long entriesChecked) {
        return new AuditChainVerification(true, entriesChecked, null, null);
    }

    public static AuditChainVerification broken(long entriesChecked, long sequenceNo, String reason) {
        return new AuditChainVerification(false, entriesChecked, sequenceNo, reason);
    }
}
