package com.z254.lazarus.remediation;

import com.z254.lazarus.domain.model.StepResult;
import reactor.core.publisher.Mono;

/**
 * Result of one step: the recorded {@link StepResult} and, on failure, its {@link StepError}.
 * A step that changed the resource and declares rollback also carries the deferred rollback that
 * undoes it when a later step of the same attempt fails.
 */
public record StepOutcome(StepResult result, StepError error, Mono<Void> undo) {

    public static StepOutcome success(StepResult result) {
        return new StepOutcome(result, null, null);
    }

    public static StepOutcome success(StepResult result, Mono<Void> undo) {
        return new StepOutcome(result, null, undo);
    }

    public static StepOutcome failure(StepResult result, StepError error) {
        return new StepOutcome(result, error, null);
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean isReversible() {
        return undo != null;
    }
}
