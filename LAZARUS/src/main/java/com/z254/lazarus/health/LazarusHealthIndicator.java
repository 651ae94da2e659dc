package com.z254.lazarus.health;

import com.z254.lazarus.audit.AuditChainVerification;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.detection.DetectorPool;
import com.z254.lazarus.escalation.AutomationGuard;
import com.z254.lazarus.escalation.EscalationManager;
import com.z254.lazarus.escalation.EscalationTicket;
import com.z254.lazarus.escalation.FallbackModeRegistry;
import com.z254.lazarus.lock.ResourceLockManager;
import com.z254.lazarus.observability.RemediationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the remediation engine.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Audit chain integrity (DOWN when the chain is broken)</li>
 *     <li>Active incidents, running attempts and held locks</li>
 *     <li>Open escalations, fallback modes and resources with automation disabled</li>
 *     <li>Disabled detectors</li>
 * </ul>
 */
@Slf4j
@Component
public class LazarusHealthIndicator implements ReactiveHealthIndicator {

    private final AuditLedger auditLedger;
    private final RemediationMetrics metrics;
    private final ResourceLockManager lockManager;
    private final EscalationManager escalationManager;
    private final FallbackModeRegistry fallbackModes;
    private final AutomationGuard automationGuard;
    private final DetectorPool detectorPool;

    public LazarusHealthIndicator(AuditLedger auditLedger,
                                  RemediationMetrics metrics,
                                  ResourceLockManager lockManager,
                                  EscalationManager escalationManager,
                                  FallbackModeRegistry fallbackModes,
                                  AutomationGuard automationGuard,
                                  DetectorPool detectorPool) {
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.lockManager = lockManager;
        this.escalationManager = escalationManager;
        this.fallbackModes = fallbackModes;
        this.automationGuard = automationGuard;
        this.detectorPool = detectorPool;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean healthy = true;

        try {
            AuditChainVerification verification = auditLedger.verify();
            details.put("audit.entries", verification.entriesChecked());
            details.put("audit.chainValid", verification.valid());
            if (!verification.valid()) {
                healthy = false;
                details.put("audit.error", verification.reason());
            }
        } catch (RuntimeException e) {
            healthy = false;
            details.put("audit.error", "Failed to verify audit chain: " + e.getMessage());
            log.error("Health check failed for audit ledger", e);
        }

        details.put("activeIncidents", metrics.getActiveIncidents());
        details.put("activeAttempts", metrics.getActiveAttempts());
        details.put("lockedResources", lockManager.snapshot().size());
        details.put("openEscalations", escalationManager.list(EscalationTicket.TicketStatus.OPEN).size());
        details.put("fallbackModes", fallbackModes.list().size());
        details.put("automationDisabled", automationGuard.snapshot().keySet());
        details.put("detectors", detectorPool.list().size());
        details.put("detectorsDisabled", detectorPool.list().stream().filter(d -> !d.isEnabled()).count());

        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }
}
