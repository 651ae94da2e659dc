package com.z254.lazarus.trigger;

/**
 * Receives every trigger decision, in per-resource order, after the failure was evaluated.
 */
public interface FailureHandler {

    void onDecision(TriggerDecision decision);
}
