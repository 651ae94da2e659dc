package com.z254.lazarus.lock;

/**
 * Outcome of {@link ResourceLockManager#acquire}.
 *
 * @param lock         the granted lock when {@link Outcome#ACQUIRED}
 * @param position     1-based queue position when {@link Outcome#QUEUED}
 * @param coalescedInto incident that absorbs the request when {@link Outcome#COALESCED}
 */
public record LockResult(Outcome outcome, ResourceLock lock, int position, String coalescedInto) {

    public enum Outcome {
        ACQUIRED,
        QUEUED,
        COALESCED
    }

    public static LockResult acquired(ResourceLock lock) {
        return new LockResult(Outcome.ACQUIRED, lock, 0, null);
    }

    public static LockResult queued(int position) {
        return new LockResult(Outcome.QUEUED, null, position, null);
    }

    public static LockResult coalesced(String incidentId) {
        return new LockResult(Outcome.COALESCED, null, 0, incidentId);
    }

    public boolean isAdmitted() {
        return outcome != Outcome.COALESCED;
    }
}
