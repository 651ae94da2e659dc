package com.z254.lazarus.governance;

import com.z254.lazarus.config.LazarusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caps remediation attempts per resource over a rolling hour, so a flapping resource cannot
 * be remediated in a tight loop.
 */
@Slf4j
@Component
public class RemediationRateLimiter {

    static final Duration WINDOW = Duration.ofHours(1);

    private final int maxAttempts;
    private final Clock clock;
    private final Map<String, Deque<Instant>> attempts = new ConcurrentHashMap<>();

    @Autowired
    public RemediationRateLimiter(LazarusProperties properties) {
        this(properties.getGovernance().getMaxAttemptsPerResourcePerHour(), Clock.systemUTC());
    }

    public RemediationRateLimiter(int maxAttempts, Clock clock) {
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    /**
     * Record an attempt if the resource is under its limit.
     *
     * @return false when the limit is reached; nothing is recorded then
     */
    public boolean tryAcquire(String resourceKey) {
        Instant now = clock.instant();
        Deque<Instant> window = attempts.computeIfAbsent(resourceKey, k -> new ArrayDeque<>());
        synchronized (window) {
            evictBefore(window, now.minus(WINDOW));
            if (window.size() >= maxAttempts) {
                log.warn("Rate limit reached for {}: {} attempts in the last hour", resourceKey, window.size());
                return false;
            }
            window.addLast(now);
            return true;
        }
    }

    public int recentAttempts(String resourceKey) {
        Deque<Instant> window = attempts.get(resourceKey);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            evictBefore(window, clock.instant().minus(WINDOW));
            return window.size();
        }
    }

    private static void evictBefore(Deque<Instant> window, Instant cutoff) {
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.pollFirst();
        }
    }
}
