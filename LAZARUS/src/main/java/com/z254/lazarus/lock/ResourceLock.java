package com.z254.lazarus.lock;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped, leased guard over one resource key. Closing it releases the key exactly once.
 */
public final class ResourceLock implements AutoCloseable {

    private final ResourceLockManager manager;
    private final String resourceKey;
    private final String incidentId;
    private final String token = UUID.randomUUID().toString();
    private final Instant acquiredAt;
    private volatile Instant expiresAt;
    private final AtomicBoolean released = new AtomicBoolean();

    ResourceLock(ResourceLockManager manager, String resourceKey, String incidentId,
                 Instant acquiredAt, Instant expiresAt) {
        this.manager = manager;
        this.resourceKey = resourceKey;
        this.incidentId = incidentId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
    }

    /**
     * Extend the lease from now.
     *
     * @return false if the lock was already released or reclaimed
     */
    public boolean renew() {
        return manager.renew(this);
    }

    @Override
    public void close() {
        manager.release(this);
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    void extendTo(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public String getToken() {
        return token;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "ResourceLock{" + resourceKey + " held by " + incidentId + ", expires " + expiresAt + "}";
    }
}
