package com.z254.lazarus.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Audit store kept in process memory.
 */
public class InMemoryAuditLedgerStore implements AuditLedgerStore {

    private final List<AuditEntry> entries = new ArrayList<>();
    private final ReadWriteLock rw = new ReentrantReadWriteLock();

    @Override
    public void append(AuditEntry entry) {
        rw.writeLock().lock();
        try {
            entries.add(entry);
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public Optional<AuditEntry> last() {
        rw.readLock().lock();
        try {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> read(long fromSequence, int limit) {
        rw.readLock().lock();
        try {
            // sequence numbers start at 1 and are contiguous
            int start = (int) Math.max(0, fromSequence - 1);
            if (start >= entries.size()) {
                return List.of();
            }
            int end = (int) Math.min(entries.size(), (long) start + limit);
            return List.copyOf(entries.subList(start, end));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> readAll() {
        rw.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public long size() {
        rw.readLock().lock();
        try {
            return entries.size();
        } finally {
            rw.readLock().unlock();
        }
    }
}
