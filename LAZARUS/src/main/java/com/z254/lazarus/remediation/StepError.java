package com.z254.lazarus.remediation;

/**
 * A step failure, carried as a value rather than thrown.
 */
public record StepError(StepErrorKind kind, String message) {

    /**
     * Only a failed rollback stops the retry policy and escalates straight away.
     */
    public boolean isFatal() {
        return kind == StepErrorKind.ROLLBACK_FAILED;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
