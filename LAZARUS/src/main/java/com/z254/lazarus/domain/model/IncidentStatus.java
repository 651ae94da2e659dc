package com.z254.lazarus.domain.model;

/**
 * Incident lifecycle states.
 * <pre>
 * DETECTED -> ANALYZING -> REMEDIATING -> VERIFYING -> RESOLVED
 * ANALYZING -> ESCALATED
 * REMEDIATING -> ESCALATED | FAILED
 * VERIFYING -> REMEDIATING (retry) | ESCALATED | FAILED
 * </pre>
 */
public enum IncidentStatus {
    DETECTED,
    ANALYZING,
    REMEDIATING,
    VERIFYING,
    RESOLVED,
    ESCALATED,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ESCALATED || this == FAILED;
    }

    public boolean canTransitionTo(IncidentStatus next) {
        return switch (this) {
            case DETECTED -> next == ANALYZING;
            case ANALYZING -> next == REMEDIATING || next == ESCALATED;
            case REMEDIATING -> next == VERIFYING || next == ESCALATED || next == FAILED;
            case VERIFYING -> next == RESOLVED || next == REMEDIATING
                    || next == ESCALATED || next == FAILED;
            case RESOLVED, ESCALATED, FAILED -> false;
        };
    }
}
