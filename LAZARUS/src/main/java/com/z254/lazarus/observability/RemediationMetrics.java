package com.z254.lazarus.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized Micrometer meters for LAZARUS, scraped through {@code /actuator/prometheus}.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Incident lifecycle (opened, coalesced, resolved, escalated, MTTR)</li>
 *     <li>Remediation attempts per playbook (outcome, duration, rollbacks)</li>
 *     <li>Coverage gaps and detector auto-disables</li>
 *     <li>Escalations and metric alerts</li>
 * </ul>
 */
@Component
public class RemediationMetrics {

    private final MeterRegistry meterRegistry;

    // Incident metrics
    @Getter
    private final Counter incidentsOpened;
    @Getter
    private final Counter incidentsCoalesced;
    @Getter
    private final Counter incidentsResolved;
    @Getter
    private final Counter incidentsFailed;
    private final Timer incidentMttr;
    private final AtomicInteger activeIncidents;

    // Remediation metrics
    @Getter
    private final Counter rollbacks;
    @Getter
    private final Counter rollbackFailures;
    private final AtomicInteger activeAttempts;

    // Detection metrics
    @Getter
    private final Counter failuresReceived;

    public RemediationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize incident metrics
        this.incidentsOpened = Counter.builder("lazarus.incidents.opened")
                .description("Incidents opened")
                .register(meterRegistry);
        this.incidentsCoalesced = Counter.builder("lazarus.incidents.coalesced")
                .description("Failures coalesced into an open incident")
                .register(meterRegistry);
        this.incidentsResolved = Counter.builder("lazarus.incidents.resolved")
                .description("Incidents resolved by remediation")
                .register(meterRegistry);
        this.incidentsFailed = Counter.builder("lazarus.incidents.failed")
                .description("Incidents that ended FAILED")
                .register(meterRegistry);
        this.incidentMttr = Timer.builder("lazarus.incidents.mttr")
                .description("Detection to resolution time")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.activeIncidents = meterRegistry.gauge("lazarus.incidents.active", new AtomicInteger(0));

        // Initialize remediation metrics
        this.rollbacks = Counter.builder("lazarus.remediation.rollbacks")
                .description("Step rollbacks executed")
                .register(meterRegistry);
        this.rollbackFailures = Counter.builder("lazarus.remediation.rollback_failures")
                .description("Rollbacks that failed")
                .register(meterRegistry);
        this.activeAttempts = meterRegistry.gauge("lazarus.remediation.active", new AtomicInteger(0));

        this.failuresReceived = Counter.builder("lazarus.failures.received")
                .description("Failures received from detectors and signal intake")
                .register(meterRegistry);
    }

    // ========== Incident Methods ==========

    public void recordIncidentOpened() {
        incidentsOpened.increment();
        activeIncidents.incrementAndGet();
    }

    public void recordIncidentCoalesced() {
        incidentsCoalesced.increment();
    }

    public void recordIncidentResolved(Duration mttr) {
        incidentsResolved.increment();
        activeIncidents.decrementAndGet();
        incidentMttr.record(mttr);
    }

    public void recordIncidentEscalated(String reason) {
        activeIncidents.decrementAndGet();
        meterRegistry.counter("lazarus.incidents.escalated", "reason", reason).increment();
    }

    public void recordIncidentFailed() {
        incidentsFailed.increment();
        activeIncidents.decrementAndGet();
    }

    public int getActiveIncidents() {
        return activeIncidents.get();
    }

    // ========== Remediation Methods ==========

    public Timer.Sample startAttempt() {
        activeAttempts.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordAttempt(Timer.Sample sample, String playbookId, String faultKind, boolean success) {
        activeAttempts.decrementAndGet();
        sample.stop(Timer.builder("lazarus.remediation.duration")
                .description("Remediation attempt duration")
                .tag("playbook", playbookId)
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry));
        meterRegistry.counter("lazarus.remediation.attempts",
                "playbook", playbookId,
                "kind", faultKind,
                "outcome", success ? "success" : "failure").increment();
    }

    public void recordStepError(String errorKind) {
        meterRegistry.counter("lazarus.remediation.step_errors", "kind", errorKind).increment();
    }

    public void recordRollback(boolean success) {
        rollbacks.increment();
        if (!success) {
            rollbackFailures.increment();
        }
    }

    public int getActiveAttempts() {
        return activeAttempts.get();
    }

    // ========== Detection Methods ==========

    public void recordFailureReceived() {
        failuresReceived.increment();
    }

    public void recordCoverageGap(String faultKind) {
        meterRegistry.counter("lazarus.coverage.gaps", "kind", faultKind).increment();
    }

    public void recordDetectorDisabled(String detectorId) {
        meterRegistry.counter("lazarus.detectors.disabled", "detector", detectorId).increment();
    }

    // ========== Alert Methods ==========

    public void recordAlert(String alertType, String scope) {
        meterRegistry.counter("lazarus.alerts", "type", alertType, "scope", scope).increment();
    }
}
