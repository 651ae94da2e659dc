package com.z254.lazarus.remediation;

import com.z254.lazarus.config.LazarusProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff with jitter between remediation attempts of one incident.
 * <p>
 * The delay before attempt {@code n} (n >= 2) is {@code base * 2^(n-2)}, randomized by
 * {@code [1 - jitter, 1 + jitter]} and capped at the maximum delay.
 */
@Component
public class BackoffPolicy {

    private static final double MULTIPLIER = 2.0;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final IntervalFunction intervals;

    @Autowired
    public BackoffPolicy(LazarusProperties properties) {
        this(properties.getRetry().getBaseDelay(), properties.getRetry().getMaxDelay(),
                properties.getRetry().getJitter());
    }

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.intervals = jitter > 0
                ? IntervalFunction.ofExponentialRandomBackoff(baseDelay.toMillis(), MULTIPLIER, jitter,
                        maxDelay.toMillis())
                : IntervalFunction.ofExponentialBackoff(baseDelay.toMillis(), MULTIPLIER, maxDelay.toMillis());
    }

    /**
     * Delay to wait before starting the given attempt.
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        // interval functions count retries from 1
        long millis = intervals.apply(Math.min(attempt - 1, 32));
        return Duration.ofMillis(Math.max(1, Math.min(maxDelay.toMillis(), millis)));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
