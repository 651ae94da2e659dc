package com.z254.lazarus.action;

import reactor.core.publisher.Mono;

/**
 * An action bound to an {@link ActionKind}, together with its optional verify, rollback and
 * dry-run capabilities.
 * <p>
 * Implementations must be idempotent: running {@link #execute} against a resource that is already
 * in the desired state returns {@link ActionResult#noOp} and changes nothing.
 */
public interface RemediationAction {

    ActionKind kind();

    Mono<ActionResult> execute(ActionContext context);

    default boolean supportsVerify() {
        return false;
    }

    /**
     * Check that the action had the intended effect.
     */
    default Mono<Boolean> verify(ActionContext context) {
        return Mono.just(true);
    }

    default boolean supportsRollback() {
        return false;
    }

    /**
     * Undo the action. Completes empty on success, errors when the resource could not be restored.
     */
    default Mono<Void> rollback(ActionContext context) {
        return Mono.error(new UnsupportedOperationException(kind().id() + " cannot be rolled back"));
    }

    default boolean supportsDryRun() {
        return false;
    }

    /**
     * Report what {@link #execute} would do, without side effects.
     */
    default Mono<ActionResult> dryRun(ActionContext context) {
        return Mono.error(new UnsupportedOperationException(kind().id() + " has no dry run"));
    }
}
