package com.z254.lazarus.domain.service;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.IllegalIncidentTransitionException;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.IncidentStatus;
import com.z254.lazarus.domain.repository.IncidentRepository;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.IncidentEventType;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.Playbook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Central service for managing incident lifecycle state.
 * <p>
 * Every mutation runs inside an atomic repository update and is appended to the audit ledger
 * before the incident changes, so the ledger always holds the intent of a change first.
 */
@Slf4j
@Service
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final AuditLedger auditLedger;
    private final RemediationMetrics metrics;
    private final LazarusStructuredLogger structuredLogger;
    private final List<IncidentEventListener> listeners;

    public IncidentService(IncidentRepository incidentRepository,
                           AuditLedger auditLedger,
                           RemediationMetrics metrics,
                           LazarusStructuredLogger structuredLogger,
                           List<IncidentEventListener> listeners) {
        this.incidentRepository = incidentRepository;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.listeners = listeners;
    }

    /**
     * Open a new incident for a failure, with the playbook selected to remediate it.
     */
    public Incident open(Failure failure, Playbook playbook) {
        return open(UUID.randomUUID().toString(), failure, playbook);
    }

    /**
     * Open an incident under a pre-assigned id, used when the id must be known before the
     * incident exists (e.g. to request its resource lock).
     */
    public Incident open(String incidentId, Failure failure, Playbook playbook) {
        Incident incident = Incident.builder()
                .id(incidentId)
                .resourceKey(failure.getResourceKey())
                .kind(failure.getKind())
                .severity(failure.getSeverity())
                .detectorId(failure.getDetectorId())
                .detectedAt(failure.getDetectedAt())
                .lastFailureAt(failure.getDetectedAt())
                .playbookId(playbook.getId())
                .playbookVersion(playbook.getVersion())
                .build();
        incident.getContext().putAll(failure.getContext());
        return create(incident, failure.getDetectorId(), "Opened by " + failure.getDetectorId());
    }

    /**
     * Open a follow-up incident of a terminal one, for an approved or operator-requested attempt.
     * The follow-up keeps the original detection time so that its MTTR covers the whole outage.
     */
    public Incident openFollowUp(String incidentId, Incident parent, Playbook playbook, boolean approved,
                                 String actor) {
        Incident incident = Incident.builder()
                .id(incidentId)
                .resourceKey(parent.getResourceKey())
                .kind(parent.getKind())
                .severity(parent.getSeverity())
                .detectorId(parent.getDetectorId())
                .detectedAt(parent.getDetectedAt())
                .lastFailureAt(parent.getLastFailureAt())
                .playbookId(playbook.getId())
                .playbookVersion(playbook.getVersion())
                .parentIncidentId(parent.getId())
                .approved(approved)
                .build();
        incident.getContext().putAll(parent.getContext());
        return create(incident, actor, "Follow-up of " + parent.getId() + (approved ? " (approved by " + actor + ")" : ""));
    }

    /**
     * Fold a repeated failure into an open incident. Status and attempt count are unchanged.
     */
    public Incident coalesce(String incidentId, Failure failure) {
        Incident incident = mutate(incidentId, failure.getDetectorId(), "incident_coalesced",
                Map.of("failureId", failure.getId(), "kind", failure.getKind()),
                i -> i.coalesce(failure));
        metrics.recordIncidentCoalesced();
        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.COALESCED,
                "Failure coalesced", Map.of("coalescedCount", incident.getCoalescedCount()));
        return incident;
    }

    /**
     * Move an incident along the state machine.
     *
     * @throws IllegalIncidentTransitionException if the move is not allowed
     */
    public Incident transition(String incidentId, IncidentStatus next, String actor, String note) {
        Incident incident = incidentRepository.update(incidentId, i -> {
            checkTransition(i, next);
            audit(actor, "incident_transition", i, transitionPayload(i, next, note));
            i.transitionTo(next, actor, note);
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));

        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.TRANSITION,
                "Incident now " + next, Map.of("status", next.name()));
        publish(incident, "transition");
        return incident;
    }

    /**
     * Count a new remediation attempt and return its number. The attempt is only started while
     * the incident is REMEDIATING; an incident that was escalated or aborted in the meantime
     * yields an empty result and is left untouched.
     */
    public OptionalInt beginAttempt(String incidentId) {
        AtomicInteger started = new AtomicInteger();
        incidentRepository.update(incidentId, i -> {
            if (i.getStatus() != IncidentStatus.REMEDIATING) {
                return i;
            }
            audit("executor", "attempt_started", i, Map.of("attempt", i.getAttemptCount() + 1,
                    "playbookId", String.valueOf(i.getPlaybookId())));
            i.setAttemptCount(i.getAttemptCount() + 1);
            i.addTimelineEvent(Incident.TimelineEventType.EXECUTION_STARTED, "executor",
                    "Attempt " + i.getAttemptCount() + " started");
            started.set(i.getAttemptCount());
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));
        return started.get() == 0 ? OptionalInt.empty() : OptionalInt.of(started.get());
    }

    /**
     * Attach a finished execution record to its incident.
     *
     * @throws IllegalIncidentTransitionException if the incident already reached a terminal state
     */
    public Incident recordExecution(String incidentId, ExecutionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", record.getId());
        payload.put("attempt", record.getAttempt());
        payload.put("success", record.isSuccess());
        payload.put("dryRun", record.isDryRun());
        payload.put("changed", record.isChanged());
        payload.put("preStateHash", record.getPreStateHash());
        payload.put("postStateHash", record.getPostStateHash());
        if (record.getFailure() != null) {
            payload.put("errorKind", record.getFailure().kind().name());
            payload.put("error", record.getFailure().message());
        }
        return incidentRepository.update(incidentId, i -> {
            if (i.getStatus().isTerminal()) {
                throw new IllegalIncidentTransitionException(i.getId(), i.getStatus(), IncidentStatus.VERIFYING);
            }
            audit("executor", "execution_recorded", i, payload);
            i.addExecution(record);
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));
    }

    /**
     * Resolve a verified incident and persist its MTTR on the incident and its final execution.
     */
    public Incident resolve(String incidentId) {
        Instant resolvedAt = Instant.now();
        Incident incident = incidentRepository.update(incidentId, i -> {
            checkTransition(i, IncidentStatus.RESOLVED);
            Map<String, Object> payload = transitionPayload(i, IncidentStatus.RESOLVED, "verified healthy");
            payload.put("resolvedAt", resolvedAt.toString());
            payload.put("mttrSeconds", Duration.between(i.getDetectedAt(), resolvedAt).toMillis() / 1000.0);
            audit("executor", "incident_resolved", i, payload);
            i.resolve(resolvedAt, "executor");
            ExecutionRecord last = i.lastExecution();
            if (last != null) {
                last.setMttrSeconds(i.getMttrSeconds());
            }
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));

        metrics.recordIncidentResolved(Duration.ofMillis(Math.round(incident.getMttrSeconds() * 1000)));
        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.RESOLVED,
                "Incident resolved", Map.of("mttrSeconds", incident.getMttrSeconds(),
                        "attempts", incident.getAttemptCount()));
        publish(incident, "resolved");
        return incident;
    }

    /**
     * Hand an incident to an operator.
     */
    public Incident escalate(String incidentId, String ticketId, String reason) {
        Incident incident = incidentRepository.update(incidentId, i -> {
            checkTransition(i, IncidentStatus.ESCALATED);
            Map<String, Object> payload = transitionPayload(i, IncidentStatus.ESCALATED, reason);
            payload.put("ticketId", ticketId);
            audit("escalation", "incident_escalated", i, payload);
            i.setEscalationTicketId(ticketId);
            i.transitionTo(IncidentStatus.ESCALATED, "escalation", reason);
            i.addTimelineEvent(Incident.TimelineEventType.ESCALATED, "escalation", "Ticket " + ticketId);
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));

        metrics.recordIncidentEscalated(reason);
        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.ESCALATED,
                "Incident escalated", Map.of("reason", reason, "ticketId", ticketId));
        publish(incident, "escalated");
        return incident;
    }

    /**
     * Mark an incident FAILED after an unrecoverable error, linking the escalation ticket.
     */
    public Incident fail(String incidentId, String ticketId, String reason) {
        Incident incident = incidentRepository.update(incidentId, i -> {
            checkTransition(i, IncidentStatus.FAILED);
            Map<String, Object> payload = transitionPayload(i, IncidentStatus.FAILED, reason);
            if (ticketId != null) {
                payload.put("ticketId", ticketId);
            }
            audit("executor", "incident_failed", i, payload);
            i.setEscalationTicketId(ticketId);
            i.transitionTo(IncidentStatus.FAILED, "executor", reason);
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));

        metrics.recordIncidentFailed();
        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.FAILED,
                "Incident failed", Map.of("reason", reason));
        publish(incident, "failed");
        return incident;
    }

    /**
     * Record a timeline event, audited like any other mutation.
     */
    public Incident note(String incidentId, Incident.TimelineEventType type, String actor, String description) {
        return mutate(incidentId, actor, "incident_" + type.name().toLowerCase(Locale.ROOT),
                Map.of("description", description), i -> i.addTimelineEvent(type, actor, description));
    }

    public Optional<Incident> get(String incidentId) {
        return incidentRepository.findById(incidentId);
    }

    public Incident require(String incidentId) {
        return get(incidentId).orElseThrow(() -> new NotFoundException("Incident", incidentId));
    }

    public List<Incident> list(IncidentStatus status) {
        return incidentRepository.findAll().stream()
                .filter(incident -> status == null || incident.getStatus() == status)
                .toList();
    }

    public List<Incident> listActive() {
        return incidentRepository.findAll().stream()
                .filter(Incident::isActive)
                .toList();
    }

    /**
     * All incidents of a resource, oldest first, including archived ones.
     */
    public List<Incident> history(String resourceKey) {
        return incidentRepository.findByResourceKey(resourceKey);
    }

    /**
     * The most recent non-terminal incident of a resource.
     */
    public Optional<Incident> findActive(String resourceKey) {
        List<Incident> history = incidentRepository.findByResourceKey(resourceKey);
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isActive()) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    // ========== Private Methods ==========

    private Incident create(Incident incident, String actor, String description) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("resourceKey", incident.getResourceKey());
        payload.put("kind", incident.getKind());
        payload.put("severity", incident.getSeverity().name());
        payload.put("playbookId", incident.getPlaybookId());
        payload.put("playbookVersion", incident.getPlaybookVersion());
        if (incident.getParentIncidentId() != null) {
            payload.put("parentIncidentId", incident.getParentIncidentId());
        }
        audit(actor, "incident_opened", incident, payload);
        incident.addTimelineEvent(Incident.TimelineEventType.CREATED, actor, description);
        incidentRepository.save(incident);

        metrics.recordIncidentOpened();
        structuredLogger.logIncidentEvent(incident.getId(), incident.getResourceKey(), IncidentEventType.OPENED,
                description, Map.of("kind", incident.getKind(), "playbookId", incident.getPlaybookId()));
        publish(incident, "opened");
        return incident;
    }

    private Incident mutate(String incidentId, String actor, String action, Map<String, Object> payload,
                            Consumer<Incident> mutation) {
        return incidentRepository.update(incidentId, i -> {
            audit(actor, action, i, payload);
            mutation.accept(i);
            return i;
        }).orElseThrow(() -> new NotFoundException("Incident", incidentId));
    }

    private void checkTransition(Incident incident, IncidentStatus next) {
        if (!incident.getStatus().canTransitionTo(next)) {
            throw new IllegalIncidentTransitionException(incident.getId(), incident.getStatus(), next);
        }
    }

    private Map<String, Object> transitionPayload(Incident incident, IncidentStatus next, String note) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", incident.getStatus().name());
        payload.put("to", next.name());
        if (note != null) {
            payload.put("note", note);
        }
        return payload;
    }

    private void audit(String actor, String action, Incident incident, Map<String, Object> payload) {
        Map<String, Object> entry = new LinkedHashMap<>(payload);
        entry.put("incidentId", incident.getId());
        entry.put("resourceKey", incident.getResourceKey());
        auditLedger.append(actor == null ? "engine" : actor, action, entry);
    }

    private void publish(Incident incident, String eventType) {
        for (IncidentEventListener listener : listeners) {
            try {
                listener.onIncidentEvent(incident, eventType);
            } catch (RuntimeException e) {
                log.warn("Incident listener {} failed for {}: {}", listener.getClass().getSimpleName(),
                        incident.getId(), e.getMessage());
            }
        }
    }
}
