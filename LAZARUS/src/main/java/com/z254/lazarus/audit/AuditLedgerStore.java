package com.z254.lazarus.audit;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of audit entries. Entries are never modified or deleted.
 * Callers serialize appends; implementations only need to make reads safe.
 */
public interface AuditLedgerStore {

    void append(AuditEntry entry);

    Optional<AuditEntry> last();

    /**
     * Entries with {@code sequenceNo >= fromSequence}, at most {@code limit} of them.
     */
    List<AuditEntry> read(long fromSequence, int limit);

    List<AuditEntry> readAll();

    long size();
}
