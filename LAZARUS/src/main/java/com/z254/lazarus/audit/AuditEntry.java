package com.z254.lazarus.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable, hash-chained record of the audit ledger.
 *
 * @param sequenceNo position in the chain, starting at 1
 * @param prevHash   hash of the previous entry (64 zeros for the first)
 * @param hash       SHA-256 over {@code prevHash} and the canonical form of this entry
 */
public record AuditEntry(
        long sequenceNo,
        String prevHash,
        String hash,
        Instant timestamp,
        String actor,
        String action,
        Map<String, Object> payload
) {
}
