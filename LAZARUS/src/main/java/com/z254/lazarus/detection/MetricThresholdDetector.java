package com.z254.lazarus.detection;

import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;
import lombok.Builder;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reports a failure when a sampled metric crosses a threshold, e.g. storage usage above 90%.
 */
public class MetricThresholdDetector implements Detector {

    public static final String KIND = "metric_threshold";

    private final String id;
    private final String resourceKey;
    private final String faultKind;
    private final String metricName;
    private final Supplier<Double> sampler;
    private final double threshold;
    private final Comparison comparison;
    private final Severity severity;
    private final Duration pollInterval;

    @Builder
    public MetricThresholdDetector(String id, String resourceKey, String faultKind, String metricName,
                                   Supplier<Double> sampler, double threshold, Comparison comparison,
                                   Severity severity, Duration pollInterval) {
        this.id = id;
        this.resourceKey = resourceKey;
        this.faultKind = faultKind;
        this.metricName = metricName;
        this.sampler = sampler;
        this.threshold = threshold;
        this.comparison = comparison == null ? Comparison.ABOVE : comparison;
        this.severity = severity == null ? Severity.MEDIUM : severity;
        this.pollInterval = pollInterval == null ? Duration.ofSeconds(10) : pollInterval;
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
        Double value;
        try {
            value = sampler.get();
        } catch (RuntimeException e) {
            throw new DetectionException("Sampling " + metricName + " failed", e);
        }
        if (value == null || value.isNaN()) {
            throw new DetectionException("No sample for " + metricName);
        }
        if (!comparison.breaches(value, threshold)) {
            return Optional.empty();
        }
        return Optional.of(Failure.builder()
                .detectorId(id)
                .resourceKey(resourceKey)
                .kind(faultKind)
                .severity(severity)
                .context(Map.of(
                        "metric", metricName,
                        "value", String.valueOf(value),
                        "threshold", String.valueOf(threshold),
                        "comparison", comparison.name()))
                .build());
    }

    public enum Comparison {
        ABOVE,
        BELOW;

        boolean breaches(double value, double threshold) {
            return this == ABOVE ? value > threshold : value < threshold;
        }
    }
}
