package com.z254.lazarus.trigger;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.service.IncidentService;
import com.z254.lazarus.escalation.AutomationGuard;
import com.z254.lazarus.escalation.EscalationManager;
import com.z254.lazarus.lock.Admission;
import com.z254.lazarus.lock.LockResult;
import com.z254.lazarus.lock.ResourceLockManager;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.IncidentEventType;
import com.z254.lazarus.observability.MetricsPublisher;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns failures into incidents.
 * <p>
 * Evaluation order:
 * <ol>
 *     <li>Resources whose automation is disabled by an open escalation suppress the failure</li>
 *     <li>A failure within the cooldown of the resource's active incident is coalesced into it</li>
 *     <li>Without a matching playbook the failure is recorded as a coverage gap</li>
 *     <li>Otherwise a new incident is opened and admitted to the resource lock</li>
 * </ol>
 * Callers must evaluate failures of one resource key sequentially; {@link FailureDispatcher} does.
 */
@Slf4j
@Component
public class TriggerEngine {

    private final PlaybookRegistry playbookRegistry;
    private final IncidentService incidentService;
    private final ResourceLockManager lockManager;
    private final AutomationGuard automationGuard;
    private final EscalationManager escalationManager;
    private final AuditLedger auditLedger;
    private final RemediationMetrics metrics;
    private final MetricsPublisher metricsPublisher;
    private final LazarusStructuredLogger structuredLogger;
    private final Duration cooldown;

    public TriggerEngine(PlaybookRegistry playbookRegistry,
                         IncidentService incidentService,
                         ResourceLockManager lockManager,
                         AutomationGuard automationGuard,
                         EscalationManager escalationManager,
                         AuditLedger auditLedger,
                         RemediationMetrics metrics,
                         MetricsPublisher metricsPublisher,
                         LazarusStructuredLogger structuredLogger,
                         LazarusProperties properties) {
        this.playbookRegistry = playbookRegistry;
        this.incidentService = incidentService;
        this.lockManager = lockManager;
        this.automationGuard = automationGuard;
        this.escalationManager = escalationManager;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.metricsPublisher = metricsPublisher;
        this.structuredLogger = structuredLogger;
        this.cooldown = properties.getTrigger().getCooldown();
    }

    public TriggerDecision evaluate(Failure failure) {
        metrics.recordFailureReceived();
        String resourceKey = failure.getResourceKey();

        Optional<String> blockingTicket = automationGuard.blockingTicket(resourceKey);
        if (blockingTicket.isPresent()) {
            return suppress(failure, blockingTicket.get());
        }

        Optional<Incident> active = incidentService.findActive(resourceKey);
        if (active.isPresent() && withinCooldown(active.get(), failure)) {
            incidentService.coalesce(active.get().getId(), failure);
            return TriggerDecision.coalesced(active.get().getId());
        }

        List<Playbook> candidates = playbookRegistry.lookup(failure);
        if (candidates.isEmpty()) {
            return unhandled(failure);
        }
        return open(failure, candidates.get(0));
    }

    // ========== Private Methods ==========

    private TriggerDecision open(Failure failure, Playbook playbook) {
        String incidentId = UUID.randomUUID().toString();
        AtomicReference<Incident> opened = new AtomicReference<>();
        LockResult lockResult = lockManager.acquire(failure.getResourceKey(), incidentId, Admission.NEW,
                () -> opened.set(incidentService.open(incidentId, failure, playbook)));

        if (lockResult.outcome() == LockResult.Outcome.COALESCED) {
            incidentService.coalesce(lockResult.coalescedInto(), failure);
            return TriggerDecision.coalesced(lockResult.coalescedInto());
        }
        if (lockResult.outcome() == LockResult.Outcome.QUEUED) {
            incidentService.note(incidentId, Incident.TimelineEventType.LOCK_QUEUED, "trigger",
                    "Waiting for " + failure.getResourceKey() + " at position " + lockResult.position());
        }
        return TriggerDecision.opened(opened.get(), playbook, lockResult);
    }

    private boolean withinCooldown(Incident incident, Failure failure) {
        if (incident.getLastFailureAt() == null) {
            return false;
        }
        return !failure.getDetectedAt().isAfter(incident.getLastFailureAt().plus(cooldown));
    }

    private TriggerDecision suppress(Failure failure, String ticketId) {
        auditLedger.append(failure.getDetectorId(), "failure_suppressed", failurePayload(failure, Map.of(
                "ticketId", ticketId)));
        escalationManager.attachSuppressedFailure(ticketId, failure);
        structuredLogger.logIncidentEvent(null, failure.getResourceKey(), IncidentEventType.SUPPRESSED,
                "Automation disabled, failure attached to ticket", Map.of("ticketId", ticketId,
                        "kind", failure.getKind()));
        return TriggerDecision.suppressed("automation disabled by ticket " + ticketId);
    }

    private TriggerDecision unhandled(Failure failure) {
        auditLedger.append(failure.getDetectorId(), "failure_unhandled", failurePayload(failure, Map.of()));
        metricsPublisher.recordCoverageGap(failure.getKind());
        structuredLogger.logIncidentEvent(null, failure.getResourceKey(), IncidentEventType.UNHANDLED,
                "No playbook matches failure", Map.of("kind", failure.getKind(),
                        "severity", failure.getSeverity().name()));
        return TriggerDecision.unhandled("no playbook matches kind " + failure.getKind());
    }

    private Map<String, Object> failurePayload(Failure failure, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("failureId", failure.getId());
        payload.put("resourceKey", failure.getResourceKey());
        payload.put("kind", failure.getKind());
        payload.put("severity", failure.getSeverity().name());
        payload.put("detectedAt", failure.getDetectedAt().toString());
        payload.put("context", failure.getContext());
        payload.putAll(extra);
        return payload;
    }
}
