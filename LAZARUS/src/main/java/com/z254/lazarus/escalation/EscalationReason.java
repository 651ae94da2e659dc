package com.z254.lazarus.escalation;

/**
 * Why an incident was handed to an operator.
 */
public enum EscalationReason {
    /** Every allowed attempt failed */
    RETRY_EXHAUSTED,
    /** A rollback could not restore the resource; automation is disabled for it */
    ROLLBACK_FAILED,
    /** The playbook needs operator approval before running */
    APPROVAL_REQUIRED,
    /** The playbook is never run automatically */
    HUMAN_MANDATORY,
    /** A change freeze was active */
    CHANGE_FREEZE,
    /** The resource reached its hourly remediation limit */
    RATE_LIMITED,
    /** An operator aborted the remediation */
    OPERATOR_ABORT
}
