package com.z254.lazarus.detection;

import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Reports {@code heartbeat_timeout} when a resource has not sent a heartbeat within the timeout.
 * Heartbeats arrive through {@link #beat()}; the silence starts when the detector is created.
 */
public class HeartbeatDetector implements Detector {

    public static final String KIND = "heartbeat";
    public static final String FAULT_KIND = "heartbeat_timeout";

    private final String id;
    private final String resourceKey;
    private final Duration timeout;
    private final Duration pollInterval;
    private final Clock clock;
    private volatile Instant lastBeat;

    public HeartbeatDetector(String id, String resourceKey, Duration timeout) {
        this(id, resourceKey, timeout, pollIntervalFor(timeout), Clock.systemUTC());
    }

    public HeartbeatDetector(String id, String resourceKey, Duration timeout, Duration pollInterval, Clock clock) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Heartbeat timeout must be positive");
        }
        this.id = id;
        this.resourceKey = resourceKey;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.lastBeat = clock.instant();
    }

    public void beat() {
        lastBeat = clock.instant();
    }

    public Instant getLastBeat() {
        return lastBeat;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public String targetResourceKey() {
        return resourceKey;
    }

    @Override
    public Optional<Failure> probe() {
        Instant now = clock.instant();
        Duration silence = Duration.between(lastBeat, now);
        if (silence.compareTo(timeout) <= 0) {
            return Optional.empty();
        }
        return Optional.of(Failure.builder()
                .detectorId(id)
                .resourceKey(resourceKey)
                .kind(FAULT_KIND)
                .severity(Severity.HIGH)
                .detectedAt(now)
                .context(Map.of(
                        "silenceMs", String.valueOf(silence.toMillis()),
                        "timeoutMs", String.valueOf(timeout.toMillis()),
                        "lastBeat", lastBeat.toString()))
                .build());
    }

    private static Duration pollIntervalFor(Duration timeout) {
        Duration half = timeout.dividedBy(2);
        return half.isZero() ? Duration.ofMillis(1) : half;
    }
}
