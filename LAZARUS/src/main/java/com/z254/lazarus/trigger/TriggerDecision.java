package com.z254.lazarus.trigger;

import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.lock.LockResult;
import com.z254.lazarus.playbook.Playbook;

/**
 * Result of evaluating one failure.
 *
 * @param incident   the incident opened for the failure, only for {@link Outcome#OPENED}
 * @param incidentId incident the failure was opened as or coalesced into; null otherwise
 * @param lockResult lock admission of an opened incident
 * @param playbook   playbook selected for an opened incident
 * @param reason     why the failure was not opened, for {@link Outcome#UNHANDLED} and {@link Outcome#SUPPRESSED}
 */
public record TriggerDecision(Outcome outcome,
                              Incident incident,
                              String incidentId,
                              LockResult lockResult,
                              Playbook playbook,
                              String reason) {

    public enum Outcome {
        OPENED,
        COALESCED,
        UNHANDLED,
        SUPPRESSED
    }

    public static TriggerDecision opened(Incident incident, Playbook playbook, LockResult lockResult) {
        return new TriggerDecision(Outcome.OPENED, incident, incident.getId(), lockResult, playbook, null);
    }

    public static TriggerDecision coalesced(String incidentId) {
        return new TriggerDecision(Outcome.COALESCED, null, incidentId, null, null, null);
    }

    public static TriggerDecision unhandled(String reason) {
        return new TriggerDecision(Outcome.UNHANDLED, null, null, null, null, reason);
    }

    public static TriggerDecision suppressed(String reason) {
        return new TriggerDecision(Outcome.SUPPRESSED, null, null, null, null, reason);
    }

    /**
     * True if a new incident was opened and already holds its resource lock.
     */
    public boolean isReadyToRemediate() {
        return outcome == Outcome.OPENED && lockResult != null
                && lockResult.outcome() == LockResult.Outcome.ACQUIRED;
    }
}
