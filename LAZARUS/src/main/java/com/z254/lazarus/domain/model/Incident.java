package com.z254.lazarus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Incident entity: a fault on one resource tracked from detection to a terminal state.
 * <p>
 * Instances are only mutated through {@code IncidentService}, inside an atomic repository update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    private String id;

    /** Resource the incident concerns */
    private String resourceKey;

    /** Fault kind of the originating failure */
    private String kind;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Builder.Default
    private IncidentStatus status = IncidentStatus.DETECTED;

    /** Detector that reported the originating failure */
    private String detectorId;

    /** Detection timestamp of the originating failure */
    private Instant detectedAt;

    /** Resolution timestamp */
    private Instant resolvedAt;

    /** Last update timestamp */
    private Instant updatedAt;

    /** Playbook selected for remediation */
    private String playbookId;
    private int playbookVersion;

    /** Remediation attempts started so far */
    private int attemptCount;

    /** Failures folded into this incident by the debounce window */
    private int coalescedCount;

    /** Timestamp of the most recent failure attributed to this incident */
    private Instant lastFailureAt;

    /** Detection time to resolution, in seconds */
    private Double mttrSeconds;

    /** Incident this one follows up (approval or retry after escalation) */
    private String parentIncidentId;

    /** Whether an operator approved automated remediation */
    private boolean approved;

    /** Open escalation ticket, if any */
    private String escalationTicketId;

    /** Set once the incident reaches a terminal state */
    private boolean archived;

    @Builder.Default
    private Map<String, String> context = new ConcurrentHashMap<>();

    @Builder.Default
    private List<ExecutionRecord> executions = new CopyOnWriteArrayList<>();

    @Builder.Default
    private List<TimelineEvent> timeline = new CopyOnWriteArrayList<>();

    /**
     * Move to the given status, recording the transition on the timeline.
     *
     * @throws IllegalIncidentTransitionException if the state machine forbids the move
     */
    public void transitionTo(IncidentStatus next, String actor, String note) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalIncidentTransitionException(id, status, next);
        }
        IncidentStatus previous = status;
        this.status = next;
        if (next.isTerminal()) {
            this.archived = true;
        }
        addTimelineEvent(TimelineEventType.TRANSITION, actor,
                previous + " -> " + next + (note == null ? "" : ": " + note));
    }

    /**
     * Mark incident as resolved and compute MTTR.
     */
    public void resolve(Instant at, String actor) {
        transitionTo(IncidentStatus.RESOLVED, actor, "verified healthy");
        this.resolvedAt = at;
        if (detectedAt != null) {
            this.mttrSeconds = Duration.between(detectedAt, at).toMillis() / 1000.0;
        }
    }

    /**
     * Fold a repeated failure into this incident.
     */
    public void coalesce(Failure failure) {
        this.coalescedCount++;
        this.lastFailureAt = failure.getDetectedAt();
        this.severity = Severity.max(severity, failure.getSeverity());
        addTimelineEvent(TimelineEventType.COALESCED, failure.getDetectorId(),
                "Coalesced failure " + failure.getKind());
    }

    public void addExecution(ExecutionRecord record) {
        executions.add(record);
        addTimelineEvent(record.isSuccess() ? TimelineEventType.EXECUTION_SUCCEEDED
                        : TimelineEventType.EXECUTION_FAILED, "executor",
                "Attempt " + record.getAttempt() + " of " + record.getPlaybookId()
                        + " v" + record.getPlaybookVersion());
    }

    public void addTimelineEvent(TimelineEventType type, String actor, String description) {
        Instant now = Instant.now();
        timeline.add(TimelineEvent.builder()
                .timestamp(now)
                .type(type)
                .actor(actor)
                .description(description)
                .build());
        this.updatedAt = now;
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    public ExecutionRecord lastExecution() {
        return executions.isEmpty() ? null : executions.get(executions.size() - 1);
    }

    /**
     * Timeline event types.
     */
    public enum TimelineEventType {
        CREATED,
        COALESCED,
        TRANSITION,
        LOCK_QUEUED,
        EXECUTION_STARTED,
        EXECUTION_SUCCEEDED,
        EXECUTION_FAILED,
        RETRY_SCHEDULED,
        ABORTED,
        ESCALATED,
        APPROVED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineEvent {
        private Instant timestamp;
        private TimelineEventType type;
        private String description;
        private String actor;
    }
}
