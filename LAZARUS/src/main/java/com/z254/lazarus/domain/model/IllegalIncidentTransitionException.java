package com.z254.lazarus.domain.model;

import com.z254.lazarus.common.LazarusException;

/**
 * Raised when a status change is not permitted by the incident state machine.
 */
public class IllegalIncidentTransitionException extends LazarusException {

    private final IncidentStatus from;
    private final IncidentStatus to;

    public IllegalIncidentTransitionException(String incidentId, IncidentStatus from, IncidentStatus to) {
        super("Incident " + incidentId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public IncidentStatus getFrom() {
        return from;
    }

    public IncidentStatus getTo() {
        return to;
    }
}
