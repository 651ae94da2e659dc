package com.z254.lazarus.lock;

/**
 * Notified when a queued incident is granted its resource lock.
 * Called outside the lock table's critical section.
 */
@FunctionalInterface
public interface LockGrantListener {

    void onLockGranted(ResourceLock lock);
}
