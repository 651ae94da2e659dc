package com.z254.lazarus.action;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Emits an operator notification. Leaves the resource untouched.
 */
@Slf4j
public class NotifyOperatorAction implements RemediationAction {

    @Override
    public ActionKind kind() {
        return ActionKind.NOTIFY_OPERATOR;
    }

    @Override
    public Mono<ActionResult> execute(ActionContext context) {
        return Mono.fromCallable(() -> {
            String message = context.parameter("message", "Remediation in progress");
            log.warn("OPERATOR NOTICE: incident={}, resource={}, message={}",
                    context.getIncidentId(), context.getResourceKey(), message);
            return ActionResult.noOp("operator notified: " + message);
        });
    }

    @Override
    public boolean supportsDryRun() {
        return true;
    }

    @Override
    public Mono<ActionResult> dryRun(ActionContext context) {
        return Mono.just(ActionResult.noOp("would notify operator"));
    }
}
