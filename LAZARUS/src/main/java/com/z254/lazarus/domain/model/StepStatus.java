package com.z254.lazarus.domain.model;

/**
 * Outcome of a single playbook step within one attempt.
 */
public enum StepStatus {
    /** Action ran and verification passed */
    SUCCEEDED,
    /** Resource already in the desired state, nothing changed */
    NO_OP,
    /** Only the dry-run check ran */
    DRY_RUN,
    /** Not run (dry-run unsupported, or an earlier step failed) */
    SKIPPED,
    FAILED
}
