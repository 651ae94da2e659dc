package com.z254.lazarus.observability;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.config.LazarusProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates remediation outcomes per playbook and per fault kind and raises quality alerts.
 * <p>
 * Tracked per scope:
 * <ul>
 *     <li>Attempts, successes, failures and success rate</li>
 *     <li>MTTR p50, p95 and max over resolved incidents</li>
 *     <li>Time of the last execution</li>
 * </ul>
 * Failures that no playbook matched are counted per fault kind as coverage gaps.
 * An alert is raised once when its condition starts to hold and cleared when it stops holding.
 * Micrometer meters are kept by {@link RemediationMetrics}; this class holds the exact figures the
 * API reports.
 */
@Slf4j
@Component
public class MetricsPublisher {

    /** MTTR samples kept per scope */
    static final int MAX_MTTR_SAMPLES = 1000;

    private final LazarusProperties.Metrics config;
    private final RemediationMetrics metrics;
    private final AuditLedger auditLedger;

    private final Map<String, ScopeStats> byPlaybook = new ConcurrentHashMap<>();
    private final Map<String, ScopeStats> byKind = new ConcurrentHashMap<>();
    private final Map<String, MetricAlert> activeAlerts = new ConcurrentHashMap<>();
    private final List<MetricAlert> alertHistory = new CopyOnWriteArrayList<>();
    private final Map<String, LongAdder> coverageGaps = new ConcurrentHashMap<>();

    public MetricsPublisher(LazarusProperties properties, RemediationMetrics metrics, AuditLedger auditLedger) {
        this.config = properties.getMetrics();
        this.metrics = metrics;
        this.auditLedger = auditLedger;
    }

    /**
     * Count one finished remediation attempt.
     */
    public void recordAttempt(String playbookId, String faultKind, boolean success) {
        ScopeStats playbook = byPlaybook.computeIfAbsent(playbookId, ScopeStats::new);
        ScopeStats kind = byKind.computeIfAbsent(faultKind, ScopeStats::new);
        playbook.recordAttempt(success);
        kind.recordAttempt(success);
        evaluate(MetricAlert.ScopeType.PLAYBOOK, playbook);
        evaluate(MetricAlert.ScopeType.KIND, kind);
    }

    /**
     * Record the MTTR of a resolved incident.
     */
    public void recordResolution(String playbookId, String faultKind, Duration mttr) {
        ScopeStats playbook = byPlaybook.computeIfAbsent(playbookId, ScopeStats::new);
        ScopeStats kind = byKind.computeIfAbsent(faultKind, ScopeStats::new);
        playbook.recordMttr(mttr);
        kind.recordMttr(mttr);
        evaluate(MetricAlert.ScopeType.PLAYBOOK, playbook);
        evaluate(MetricAlert.ScopeType.KIND, kind);
    }

    /**
     * Count a failure no playbook matched.
     */
    public void recordCoverageGap(String faultKind) {
        coverageGaps.computeIfAbsent(faultKind, k -> new LongAdder()).increment();
        metrics.recordCoverageGap(faultKind);
    }

    /**
     * Unmatched failures per fault kind, sorted by kind.
     */
    public Map<String, Long> coverageGaps() {
        Map<String, Long> gaps = new TreeMap<>();
        coverageGaps.forEach((kind, count) -> gaps.put(kind, count.sum()));
        return gaps;
    }

    public List<ScopeSnapshot> playbookStats() {
        return snapshots(byPlaybook);
    }

    public List<ScopeSnapshot> kindStats() {
        return snapshots(byKind);
    }

    public Optional<ScopeSnapshot> playbookStats(String playbookId) {
        return Optional.ofNullable(byPlaybook.get(playbookId)).map(ScopeStats::snapshot);
    }

    public Optional<ScopeSnapshot> kindStats(String faultKind) {
        return Optional.ofNullable(byKind.get(faultKind)).map(ScopeStats::snapshot);
    }

    /**
     * All alerts ever raised, newest first.
     */
    public List<MetricAlert> alerts() {
        List<MetricAlert> alerts = new ArrayList<>(alertHistory);
        alerts.sort(Comparator.comparing(MetricAlert::getRaisedAt).reversed());
        return alerts;
    }

    public List<MetricAlert> activeAlerts() {
        return alerts().stream().filter(MetricAlert::isActive).toList();
    }

    // ========== Private Methods ==========

    private void evaluate(MetricAlert.ScopeType scopeType, ScopeStats stats) {
        // Decisions for one scope are taken in snapshot order.
        synchronized (stats) {
            evaluate(scopeType, stats.snapshot());
        }
    }

    private void evaluate(MetricAlert.ScopeType scopeType, ScopeSnapshot snapshot) {

        boolean rateLow = snapshot.getAttempts() >= config.getMinSamples()
                && snapshot.getSuccessRate() < config.getSuccessRateFloor();
        toggle(MetricAlert.AlertType.SUCCESS_RATE_BELOW_FLOOR, scopeType, snapshot.getScope(), rateLow,
                snapshot.getSuccessRate(), config.getSuccessRateFloor(),
                String.format("Success rate %.2f below floor %.2f over %d attempts",
                        snapshot.getSuccessRate(), config.getSuccessRateFloor(), snapshot.getAttempts()));

        double ceilingSeconds = config.getMttrP95Ceiling().toMillis() / 1000.0;
        boolean mttrHigh = snapshot.getResolved() > 0 && snapshot.getMttrP95Seconds() > ceilingSeconds;
        toggle(MetricAlert.AlertType.MTTR_P95_ABOVE_CEILING, scopeType, snapshot.getScope(), mttrHigh,
                snapshot.getMttrP95Seconds(), ceilingSeconds,
                String.format("MTTR p95 %.1fs above ceiling %.1fs", snapshot.getMttrP95Seconds(), ceilingSeconds));
    }

    private void toggle(MetricAlert.AlertType type, MetricAlert.ScopeType scopeType, String scope, boolean holds,
                        double value, double threshold, String message) {
        String key = type + "|" + scopeType + "|" + scope;
        activeAlerts.compute(key, (k, current) -> {
            if (holds) {
                return current != null ? current : raise(type, scopeType, scope, value, threshold, message);
            }
            if (current != null) {
                current.setClearedAt(Instant.now());
                auditLedger.append("metrics", "metric_alert_cleared", Map.of(
                        "alertId", current.getId(),
                        "type", type.name(),
                        "scope", scopeLabel(scopeType, scope)));
                log.info("Alert {} on {} cleared", type, scopeLabel(scopeType, scope));
            }
            return null;
        });
    }

    private MetricAlert raise(MetricAlert.AlertType type, MetricAlert.ScopeType scopeType, String scope,
                              double value, double threshold, String message) {
        MetricAlert alert = MetricAlert.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .scopeType(scopeType)
                .scope(scope)
                .value(value)
                .threshold(threshold)
                .raisedAt(Instant.now())
                .message(message)
                .build();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("type", type.name());
        payload.put("scope", scopeLabel(scopeType, scope));
        payload.put("value", value);
        payload.put("threshold", threshold);
        auditLedger.append("metrics", "metric_alert_raised", payload);
        metrics.recordAlert(type.name(), scopeLabel(scopeType, scope));
        log.warn("Remediation alert {} on {}: {}", type, scopeLabel(scopeType, scope), message);

        alertHistory.add(alert);
        return alert;
    }

    private static String scopeLabel(MetricAlert.ScopeType scopeType, String scope) {
        return scopeType.name().toLowerCase(Locale.ROOT) + ":" + scope;
    }

    private static List<ScopeSnapshot> snapshots(Map<String, ScopeStats> stats) {
        return stats.values().stream()
                .map(ScopeStats::snapshot)
                .sorted(Comparator.comparing(ScopeSnapshot::getScope))
                .toList();
    }

    /**
     * Nearest-rank percentile of sorted samples.
     */
    static double percentile(List<Double> sorted, double percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int rank = (int) Math.ceil(percentile * sorted.size());
        return sorted.get(Math.max(0, Math.min(sorted.size(), rank) - 1));
    }

    // ========== Data Classes ==========

    private static final class ScopeStats {
        private final String scope;
        private long attempts;
        private long successes;
        private long resolved;
        private double maxMttrSeconds;
        private Instant lastExecutedAt;
        private final Deque<Double> mttrSeconds = new ArrayDeque<>();

        ScopeStats(String scope) {
            this.scope = scope;
        }

        synchronized void recordAttempt(boolean success) {
            attempts++;
            if (success) {
                successes++;
            }
            lastExecutedAt = Instant.now();
        }

        synchronized void recordMttr(Duration mttr) {
            double seconds = mttr.toMillis() / 1000.0;
            resolved++;
            maxMttrSeconds = Math.max(maxMttrSeconds, seconds);
            mttrSeconds.addLast(seconds);
            if (mttrSeconds.size() > MAX_MTTR_SAMPLES) {
                mttrSeconds.removeFirst();
            }
        }

        synchronized ScopeSnapshot snapshot() {
            List<Double> sorted = new ArrayList<>(mttrSeconds);
            sorted.sort(Comparator.naturalOrder());
            return ScopeSnapshot.builder()
                    .scope(scope)
                    .attempts(attempts)
                    .successes(successes)
                    .failures(attempts - successes)
                    .successRate(attempts == 0 ? 1.0 : (double) successes / attempts)
                    .resolved(resolved)
                    .mttrP50Seconds(percentile(sorted, 0.50))
                    .mttrP95Seconds(percentile(sorted, 0.95))
                    .mttrMaxSeconds(maxMttrSeconds)
                    .lastExecutedAt(lastExecutedAt)
                    .build();
        }
    }

    @Data
    @Builder
    public static class ScopeSnapshot {
        private String scope;
        private long attempts;
        private long successes;
        private long failures;
        private double successRate;
        private long resolved;
        private double mttrP50Seconds;
        private double mttrP95Seconds;
        private double mttrMaxSeconds;
        private Instant lastExecutedAt;
    }
}
