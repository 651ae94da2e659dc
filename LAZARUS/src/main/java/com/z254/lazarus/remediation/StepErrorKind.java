package com.z254.lazarus.remediation;

/**
 * Ways a playbook step can fail.
 */
public enum StepErrorKind {
    /** The action did not finish within the step timeout */
    STEP_TIMEOUT,
    /** The action raised an error */
    STEP_FAILED,
    /** The action ran but verification did not pass */
    VERIFICATION_FAILED,
    /** Rollback could not restore the resource; escalates immediately */
    ROLLBACK_FAILED,
    /** An operator aborted the attempt */
    ABORTED
}
