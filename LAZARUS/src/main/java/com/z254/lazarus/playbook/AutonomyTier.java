package com.z254.lazarus.playbook;

/**
 * Governance classification of a playbook.
 */
public enum AutonomyTier {
    /** Runs without operator involvement */
    FULLY_AUTOMATIC,
    /** Runs only after an operator approves the incident */
    APPROVAL_REQUIRED,
    /** Never runs automatically; the incident is handed to an operator */
    HUMAN_MANDATORY
}
