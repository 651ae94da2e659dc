package com.z254.lazarus.lock;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.config.LazarusProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock table guaranteeing at most one active remediation per resource key.
 * <p>
 * Each key has at most one holder and a bounded FIFO queue of waiting incidents:
 * <ul>
 *     <li>A free key is granted immediately</li>
 *     <li>A busy key queues the request; a new incident arriving at a full queue is coalesced
 *     into the last queued incident instead</li>
 *     <li>Releasing a lock grants it to the head of the queue and notifies the
 *     {@link LockGrantListener}</li>
 *     <li>Locks are leased; expired leases are reclaimed by a scheduled reaper</li>
 * </ul>
 * The table is the only structure guarded by an explicit lock.
 */
@Slf4j
@Component
public class ResourceLockManager {

    private final LazarusProperties.Lock config;
    private final AuditLedger auditLedger;
    private final Clock clock;
    private final ReentrantLock tableLock = new ReentrantLock();
    private final Map<String, KeyState> table = new HashMap<>();
    private volatile LockGrantListener grantListener = lock -> { };

    @Autowired
    public ResourceLockManager(LazarusProperties properties, AuditLedger auditLedger) {
        this(properties.getLock(), auditLedger, Clock.systemUTC());
    }

    public ResourceLockManager(LazarusProperties.Lock config, AuditLedger auditLedger, Clock clock) {
        this.config = config;
        this.auditLedger = auditLedger;
        this.clock = clock;
    }

    public void setGrantListener(LockGrantListener grantListener) {
        this.grantListener = grantListener;
    }

    public LockResult acquire(String resourceKey, String incidentId, Admission admission) {
        return acquire(resourceKey, incidentId, admission, () -> { });
    }

    /**
     * Request the lock of a resource for an incident.
     * <p>
     * {@code onAdmitted} runs inside the table's critical section when the request is granted or
     * queued, before any other thread can hand the lock to it. If it throws, the admission is undone.
     */
    public LockResult acquire(String resourceKey, String incidentId, Admission admission, Runnable onAdmitted) {
        LockResult result;
        tableLock.lock();
        try {
            KeyState state = table.computeIfAbsent(resourceKey, k -> new KeyState());

            if (state.holder != null && state.holder.getIncidentId().equals(incidentId)) {
                return LockResult.acquired(state.holder);
            }
            int existing = state.position(incidentId);
            if (existing > 0) {
                return LockResult.queued(existing);
            }

            if (state.holder == null && state.queue.isEmpty()) {
                ResourceLock lock = newLock(resourceKey, incidentId);
                state.holder = lock;
                result = LockResult.acquired(lock);
                runAdmission(onAdmitted, () -> state.holder = null);
            } else if (admission == Admission.NEW && state.queue.size() >= config.getQueueDepth()) {
                result = LockResult.coalesced(state.queue.peekLast().incidentId());
            } else {
                Waiter waiter = new Waiter(incidentId, admission, clock.instant());
                state.queue.addLast(waiter);
                result = LockResult.queued(state.queue.size());
                runAdmission(onAdmitted, () -> state.queue.remove(waiter));
            }
        } finally {
            tableLock.unlock();
        }

        auditLedger.append("lock-manager", "lock_" + result.outcome().name().toLowerCase(Locale.ROOT), Map.of(
                "resourceKey", resourceKey,
                "incidentId", incidentId,
                "admission", admission.name(),
                "position", result.position(),
                "coalescedInto", String.valueOf(result.coalescedInto())));
        log.debug("Lock {} for {} on {}", result.outcome(), incidentId, resourceKey);
        return result;
    }

    /**
     * Release a lock and grant the key to the next queued incident. Releasing twice is a no-op.
     */
    public void release(ResourceLock lock) {
        if (!lock.markReleased()) {
            return;
        }
        ResourceLock granted;
        tableLock.lock();
        try {
            KeyState state = table.get(lock.getResourceKey());
            if (state == null || state.holder != lock) {
                return;
            }
            state.holder = null;
            granted = grantNext(lock.getResourceKey(), state);
        } finally {
            tableLock.unlock();
        }
        auditLedger.append("lock-manager", "lock_released", Map.of(
                "resourceKey", lock.getResourceKey(),
                "incidentId", lock.getIncidentId(),
                "heldMs", Duration.between(lock.getAcquiredAt(), clock.instant()).toMillis()));
        notifyGranted(granted);
    }

    /**
     * Drop a queued request, e.g. when its incident was aborted before it got the lock.
     *
     * @return true if the incident was waiting
     */
    public boolean cancel(String resourceKey, String incidentId) {
        tableLock.lock();
        try {
            KeyState state = table.get(resourceKey);
            return state != null && state.queue.removeIf(w -> w.incidentId().equals(incidentId));
        } finally {
            tableLock.unlock();
        }
    }

    boolean renew(ResourceLock lock) {
        tableLock.lock();
        try {
            KeyState state = table.get(lock.getResourceKey());
            if (lock.isReleased() || state == null || state.holder != lock) {
                return false;
            }
            lock.extendTo(clock.instant().plus(config.getLeaseTtl()));
            return true;
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Reclaim locks whose lease expired, so a crashed holder cannot block its resource forever.
     *
     * @return number of reclaimed locks
     */
    @Scheduled(fixedDelayString = "#{@lazarusProperties.lock.reaperInterval.toMillis()}")
    public int reapExpired() {
        Instant now = clock.instant();
        List<ResourceLock> expired = new ArrayList<>();
        List<ResourceLock> granted = new ArrayList<>();
        tableLock.lock();
        try {
            table.forEach((key, state) -> {
                if (state.holder != null && state.holder.getExpiresAt().isBefore(now)) {
                    ResourceLock stale = state.holder;
                    stale.markReleased();
                    state.holder = null;
                    expired.add(stale);
                    ResourceLock next = grantNext(key, state);
                    if (next != null) {
                        granted.add(next);
                    }
                }
            });
        } finally {
            tableLock.unlock();
        }
        for (ResourceLock stale : expired) {
            log.warn("Reclaimed expired lock on {} held by {}", stale.getResourceKey(), stale.getIncidentId());
            auditLedger.append("lock-manager", "lock_expired", Map.of(
                    "resourceKey", stale.getResourceKey(),
                    "incidentId", stale.getIncidentId(),
                    "expiredAt", stale.getExpiresAt().toString()));
        }
        granted.forEach(this::notifyGranted);
        return expired.size();
    }

    public Optional<String> holder(String resourceKey) {
        tableLock.lock();
        try {
            KeyState state = table.get(resourceKey);
            return state == null || state.holder == null ? Optional.empty()
                    : Optional.of(state.holder.getIncidentId());
        } finally {
            tableLock.unlock();
        }
    }

    public List<String> queued(String resourceKey) {
        tableLock.lock();
        try {
            KeyState state = table.get(resourceKey);
            return state == null ? List.of() : state.queue.stream().map(Waiter::incidentId).toList();
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Current holders and queues of all busy keys.
     */
    public Map<String, LockInfo> snapshot() {
        Map<String, LockInfo> snapshot = new TreeMap<>();
        tableLock.lock();
        try {
            table.forEach((key, state) -> {
                if (state.holder != null || !state.queue.isEmpty()) {
                    snapshot.put(key, LockInfo.builder()
                            .holder(state.holder == null ? null : state.holder.getIncidentId())
                            .expiresAt(state.holder == null ? null : state.holder.getExpiresAt())
                            .queued(state.queue.stream().map(Waiter::incidentId).toList())
                            .build());
                }
            });
        } finally {
            tableLock.unlock();
        }
        return snapshot;
    }

    // ========== Private Methods ==========

    private ResourceLock newLock(String resourceKey, String incidentId) {
        Instant now = clock.instant();
        return new ResourceLock(this, resourceKey, incidentId, now, now.plus(config.getLeaseTtl()));
    }

    /** Caller holds the table lock. */
    private ResourceLock grantNext(String resourceKey, KeyState state) {
        Waiter next = state.queue.pollFirst();
        if (next == null) {
            table.remove(resourceKey);
            return null;
        }
        ResourceLock lock = newLock(resourceKey, next.incidentId());
        state.holder = lock;
        return lock;
    }

    private void notifyGranted(ResourceLock granted) {
        if (granted == null) {
            return;
        }
        auditLedger.append("lock-manager", "lock_granted", Map.of(
                "resourceKey", granted.getResourceKey(),
                "incidentId", granted.getIncidentId()));
        try {
            grantListener.onLockGranted(granted);
        } catch (RuntimeException e) {
            log.error("Lock grant listener failed for {}, releasing lock", granted, e);
            release(granted);
        }
    }

    private static void runAdmission(Runnable onAdmitted, Runnable undo) {
        try {
            onAdmitted.run();
        } catch (RuntimeException e) {
            undo.run();
            throw e;
        }
    }

    // ========== Data Classes ==========

    private static final class KeyState {
        private ResourceLock holder;
        private final Deque<Waiter> queue = new ArrayDeque<>();

        int position(String incidentId) {
            int position = 1;
            for (Waiter waiter : queue) {
                if (waiter.incidentId().equals(incidentId)) {
                    return position;
                }
                position++;
            }
            return 0;
        }
    }

    private record Waiter(String incidentId, Admission admission, Instant queuedAt) {
    }

    @Data
    @Builder
    public static class LockInfo {
        private String holder;
        private Instant expiresAt;
        private List<String> queued;
    }
}
