package com.z254.lazarus.escalation;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.Severity;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.EscalationEventType;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands incidents that automation cannot resolve to operators.
 * <p>
 * An escalation:
 * <ul>
 *     <li>creates a ticket with root-cause context and suggested manual steps</li>
 *     <li>optionally switches the resource to a degraded fallback mode</li>
 *     <li>on a failed rollback, raises the ticket to CRITICAL and disables automation for the
 *     resource until the ticket is resolved</li>
 * </ul>
 * Incident status is owned by the caller; this service only manages tickets and switches.
 */
@Slf4j
@Service
public class EscalationManager {

    private final LazarusProperties.Escalation config;
    private final AuditLedger auditLedger;
    private final FallbackModeRegistry fallbackModes;
    private final AutomationGuard automationGuard;
    private final LazarusStructuredLogger structuredLogger;
    private final List<EscalationListener> listeners;
    private final Map<String, EscalationTicket> tickets = new ConcurrentHashMap<>();

    public EscalationManager(LazarusProperties properties,
                             AuditLedger auditLedger,
                             FallbackModeRegistry fallbackModes,
                             AutomationGuard automationGuard,
                             LazarusStructuredLogger structuredLogger,
                             List<EscalationListener> listeners) {
        this.config = properties.getEscalation();
        this.auditLedger = auditLedger;
        this.fallbackModes = fallbackModes;
        this.automationGuard = automationGuard;
        this.structuredLogger = structuredLogger;
        this.listeners = listeners;
    }

    /**
     * Create a ticket for an incident.
     *
     * @param playbook playbook that was selected, used to suggest manual steps; may be null
     * @param detail   human-readable cause, e.g. the last step error
     */
    public EscalationTicket escalate(Incident incident, EscalationReason reason, Playbook playbook, String detail) {
        boolean fatal = reason == EscalationReason.ROLLBACK_FAILED;
        boolean fallback = switch (reason) {
            case RETRY_EXHAUSTED -> config.isFallbackOnRetryExhaustion();
            case ROLLBACK_FAILED -> config.isFallbackOnRollbackFailure();
            default -> false;
        };

        EscalationTicket ticket = EscalationTicket.builder()
                .id(UUID.randomUUID().toString())
                .incidentId(incident.getId())
                .resourceKey(incident.getResourceKey())
                .playbookId(incident.getPlaybookId())
                .reason(reason)
                .severity(fatal ? Severity.CRITICAL : incident.getSeverity())
                .createdAt(Instant.now())
                .fallbackEnabled(fallback)
                .fallbackCapability(fallback ? incident.getKind() + ":degraded" : null)
                .rootCauseContext(rootCauseContext(incident, detail))
                .suggestedSteps(suggestedSteps(incident, reason, playbook))
                .build();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticketId", ticket.getId());
        payload.put("incidentId", incident.getId());
        payload.put("resourceKey", incident.getResourceKey());
        payload.put("reason", reason.name());
        payload.put("severity", ticket.getSeverity().name());
        payload.put("fallbackEnabled", fallback);
        payload.put("automationDisabled", fatal);
        if (detail != null) {
            payload.put("detail", detail);
        }
        auditLedger.append("escalation", "escalation_created", payload);

        tickets.put(ticket.getId(), ticket);
        if (fallback) {
            fallbackModes.enable(incident.getResourceKey(), ticket.getFallbackCapability(), ticket.getId());
            structuredLogger.logEscalationEvent(ticket.getId(), incident.getId(), EscalationEventType.FALLBACK_ENABLED,
                    "Fallback mode enabled", Map.of("capability", ticket.getFallbackCapability()));
        }
        if (fatal) {
            automationGuard.disable(incident.getResourceKey(), ticket.getId());
            structuredLogger.logEscalationEvent(ticket.getId(), incident.getId(), EscalationEventType.AUTOMATION_DISABLED,
                    "Automation disabled for resource", Map.of("resourceKey", incident.getResourceKey()));
        }
        structuredLogger.logEscalationEvent(ticket.getId(), incident.getId(), EscalationEventType.CREATED,
                "Escalation ticket created", Map.of("reason", reason.name(), "severity", ticket.getSeverity().name()));
        publish(ticket, "created");
        return ticket;
    }

    /**
     * Close a ticket, disabling its fallback mode and re-enabling automation for the resource.
     *
     * @throws EscalationStateException if the ticket is already resolved
     */
    public EscalationTicket resolve(String ticketId, String resolvedBy, EscalationTicket.Resolution resolution) {
        EscalationTicket ticket = require(ticketId);
        synchronized (ticket) {
            if (!ticket.isOpen()) {
                throw new EscalationStateException("Ticket " + ticketId + " is already resolved");
            }
            auditLedger.append(resolvedBy, "escalation_resolved", Map.of(
                    "ticketId", ticketId,
                    "incidentId", ticket.getIncidentId(),
                    "resourceKey", ticket.getResourceKey(),
                    "resolution", resolution.name()));
            ticket.setStatus(EscalationTicket.TicketStatus.RESOLVED);
            ticket.setResolvedAt(Instant.now());
            ticket.setResolvedBy(resolvedBy);
            ticket.setResolution(resolution);
        }

        if (fallbackModes.disable(ticket.getResourceKey(), ticketId)) {
            structuredLogger.logEscalationEvent(ticketId, ticket.getIncidentId(), EscalationEventType.FALLBACK_DISABLED,
                    "Fallback mode disabled", null);
        }
        if (automationGuard.enable(ticket.getResourceKey(), ticketId)) {
            structuredLogger.logEscalationEvent(ticketId, ticket.getIncidentId(), EscalationEventType.AUTOMATION_ENABLED,
                    "Automation re-enabled", null);
        }
        structuredLogger.logEscalationEvent(ticketId, ticket.getIncidentId(), EscalationEventType.RESOLVED,
                "Ticket resolved", Map.of("resolvedBy", resolvedBy, "resolution", resolution.name()));
        publish(ticket, "resolved");
        return ticket;
    }

    /**
     * Record a failure that arrived while automation was disabled by the given ticket.
     */
    public void attachSuppressedFailure(String ticketId, Failure failure) {
        EscalationTicket ticket = require(ticketId);
        synchronized (ticket) {
            ticket.setSuppressedFailures(ticket.getSuppressedFailures() + 1);
        }
        log.debug("Suppressed failure {} attached to ticket {}", failure.getId(), ticketId);
    }

    public Optional<EscalationTicket> get(String ticketId) {
        return Optional.ofNullable(tickets.get(ticketId));
    }

    public EscalationTicket require(String ticketId) {
        return get(ticketId).orElseThrow(() -> new NotFoundException("Escalation ticket", ticketId));
    }

    /**
     * Tickets, newest first, optionally filtered by status.
     */
    public List<EscalationTicket> list(EscalationTicket.TicketStatus status) {
        return tickets.values().stream()
                .filter(t -> status == null || t.getStatus() == status)
                .sorted(Comparator.comparing(EscalationTicket::getCreatedAt).reversed())
                .toList();
    }

    public Optional<EscalationTicket> findOpenForIncident(String incidentId) {
        return tickets.values().stream()
                .filter(t -> t.isOpen() && t.getIncidentId().equals(incidentId))
                .findFirst();
    }

    // ========== Private Methods ==========

    private Map<String, Object> rootCauseContext(Incident incident, String detail) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("kind", incident.getKind());
        context.put("severity", incident.getSeverity().name());
        context.put("detectorId", incident.getDetectorId());
        context.put("detectedAt", String.valueOf(incident.getDetectedAt()));
        context.put("attempts", incident.getAttemptCount());
        context.put("coalescedFailures", incident.getCoalescedCount());
        if (detail != null) {
            context.put("detail", detail);
        }
        ExecutionRecord last = incident.lastExecution();
        if (last != null && last.getFailure() != null) {
            context.put("lastError", last.getFailure().kind().name() + ": " + last.getFailure().message());
            context.put("preStateHash", last.getPreStateHash());
            context.put("postStateHash", last.getPostStateHash());
        }
        if (!incident.getContext().isEmpty()) {
            context.put("failureContext", Map.copyOf(incident.getContext()));
        }
        return context;
    }

    private List<String> suggestedSteps(Incident incident, EscalationReason reason, Playbook playbook) {
        List<String> steps = new ArrayList<>();
        String resource = incident.getResourceKey();
        switch (reason) {
            case ROLLBACK_FAILED -> {
                steps.add("Inspect " + resource + " and restore its state from pre-state hash in the audit ledger");
                steps.add("Resolve this ticket with RESTORE_NORMAL to re-enable automation for " + resource);
            }
            case APPROVAL_REQUIRED -> steps.add("Approve incident " + incident.getId() + " to run "
                    + (playbook == null ? "the selected playbook" : playbook.ref()));
            case CHANGE_FREEZE -> steps.add("Remediate manually or retry once the change freeze ends");
            case RATE_LIMITED -> steps.add("Investigate why " + resource + " keeps failing before retrying");
            default -> steps.add("Review the execution records of incident " + incident.getId());
        }
        if (playbook != null && reason != EscalationReason.APPROVAL_REQUIRED) {
            for (PlaybookStep step : playbook.getSteps()) {
                steps.add("Manually run " + step.getActionKind().id() + " on " + resource
                        + (step.isHasVerify() ? " and verify the result" : ""));
            }
        }
        return steps;
    }

    private void publish(EscalationTicket ticket, String eventType) {
        for (EscalationListener listener : listeners) {
            try {
                listener.onTicketEvent(ticket, eventType);
            } catch (RuntimeException e) {
                log.warn("Escalation listener {} failed for ticket {}: {}",
                        listener.getClass().getSimpleName(), ticket.getId(), e.getMessage());
            }
        }
    }
}
