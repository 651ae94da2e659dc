package com.z254.lazarus.audit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained record of every state-changing event of the engine.
 * <p>
 * Each entry stores {@code hash = SHA-256(prevHash || canonical(entry))}, so any modification or
 * removal of a stored entry is detected by {@link #verify()}. Appends are serialized through a
 * single lock, which makes the ledger the global ordering point for all mutations.
 */
@Slf4j
public class AuditLedger {

    /** Default page size of {@link #entries(long, int)} */
    public static final int DEFAULT_LIMIT = 100;

    private final AuditLedgerStore store;
    private final Clock clock;
    private final ReentrantLock appendLock = new ReentrantLock();

    public AuditLedger(AuditLedgerStore store) {
        this(store, Clock.systemUTC());
    }

    public AuditLedger(AuditLedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Append a new entry and return it. The payload is reduced to plain JSON values first.
     *
     * @throws AuditLedgerException when the store cannot persist the entry
     */
    public AuditEntry append(String actor, String action, Map<String, ?> payload) {
        appendLock.lock();
        try {
            AuditEntry previous = store.last().orElse(null);
            long sequenceNo = previous == null ? 1 : previous.sequenceNo() + 1;
            String prevHash = previous == null ? AuditJson.GENESIS_HASH : previous.hash();

            AuditEntry unsigned = new AuditEntry(sequenceNo, prevHash, null, Instant.now(clock),
                    actor, action, AuditJson.normalize(payload));
            AuditEntry entry = new AuditEntry(sequenceNo, prevHash, AuditJson.hash(prevHash, unsigned),
                    unsigned.timestamp(), actor, action, unsigned.payload());
            store.append(entry);

            log.debug("Audit #{} {} by {}", sequenceNo, action, actor);
            return entry;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Read a page of entries starting at the given sequence number.
     */
    public List<AuditEntry> entries(long fromSequence, int limit) {
        return store.read(Math.max(1, fromSequence), limit <= 0 ? DEFAULT_LIMIT : limit);
    }

    public List<AuditEntry> entries() {
        return store.readAll();
    }

    public long size() {
        return store.size();
    }

    /**
     * Walk the whole chain, checking sequence continuity, hash links and recomputed hashes.
     */
    public AuditChainVerification verify() {
        String expectedPrev = AuditJson.GENESIS_HASH;
        long expectedSeq = 1;
        long checked = 0;
        for (AuditEntry entry : store.readAll()) {
            if (entry.sequenceNo() != expectedSeq) {
                return AuditChainVerification.broken(checked, entry.sequenceNo(),
                        "expected sequence " + expectedSeq);
            }
            if (!expectedPrev.equals(entry.prevHash())) {
                return AuditChainVerification.broken(checked, entry.sequenceNo(),
                        "previous hash mismatch");
            }
            if (!AuditJson.hash(entry.prevHash(), entry).equals(entry.hash())) {
                return AuditChainVerification.broken(checked, entry.sequenceNo(), "hash mismatch");
            }
            expectedPrev = entry.hash();
            expectedSeq++;
            checked++;
        }
        return AuditChainVerification.ok(checked);
    }
}
