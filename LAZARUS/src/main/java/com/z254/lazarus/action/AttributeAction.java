package com.z254.lazarus.action;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Action that drives one resource attribute to a desired value.
 * <ul>
 *     <li>execute - no-op when the attribute already holds the desired value, otherwise captures
 *     the current value and applies the desired one</li>
 *     <li>verify - re-reads the resource and compares the attribute</li>
 *     <li>rollback - restores the captured value and confirms it was applied</li>
 *     <li>dry run - reports the pending change without applying it</li>
 * </ul>
 */
@Slf4j
public class AttributeAction implements RemediationAction {

    private final ActionKind kind;
    private final String attribute;
    private final Function<ActionContext, String> desiredValue;
    private final boolean reversible;
    private final ControlPlane controlPlane;

    public AttributeAction(ActionKind kind, String attribute, String desiredValue,
                           boolean reversible, ControlPlane controlPlane) {
        this(kind, attribute, ctx -> desiredValue, reversible, controlPlane);
    }

    public AttributeAction(ActionKind kind, String attribute, Function<ActionContext, String> desiredValue,
                           boolean reversible, ControlPlane controlPlane) {
        this.kind = kind;
        this.attribute = attribute;
        this.desiredValue = desiredValue;
        this.reversible = reversible;
        this.controlPlane = controlPlane;
    }

    @Override
    public ActionKind kind() {
        return kind;
    }

    public String attribute() {
        return attribute;
    }

    @Override
    public Mono<ActionResult> execute(ActionContext context) {
        String desired = desiredValue.apply(context);
        return controlPlane.snapshot(context.getResourceKey())
                .flatMap(state -> {
                    String current = state.attribute(attribute);
                    if (Objects.equals(current, desired)) {
                        return Mono.just(ActionResult.noOp(attribute + " already " + desired));
                    }
                    context.getCaptured().put(attribute, current == null ? "" : current);
                    log.debug("{}: {} {} -> {} on {}", kind, attribute, current, desired, context.getResourceKey());
                    return controlPlane.apply(context.getResourceKey(), Map.of(attribute, desired))
                            .thenReturn(ActionResult.changed(attribute + " " + current + " -> " + desired));
                });
    }

    @Override
    public boolean supportsVerify() {
        return true;
    }

    @Override
    public Mono<Boolean> verify(ActionContext context) {
        String desired = desiredValue.apply(context);
        return controlPlane.snapshot(context.getResourceKey())
                .map(state -> Objects.equals(state.attribute(attribute), desired));
    }

    @Override
    public boolean supportsRollback() {
        return reversible;
    }

    @Override
    public Mono<Void> rollback(ActionContext context) {
        if (!reversible) {
            return RemediationAction.super.rollback(context);
        }
        String previous = context.getCaptured().get(attribute);
        if (previous == null) {
            // execute never changed anything
            return Mono.empty();
        }
        return controlPlane.apply(context.getResourceKey(), Map.of(attribute, previous))
                .flatMap(state -> Objects.equals(nullToEmpty(state.attribute(attribute)), previous)
                        ? Mono.<Void>empty()
                        : Mono.error(new ControlPlaneException("Rollback of " + attribute + " on "
                        + context.getResourceKey() + " left value " + state.attribute(attribute))));
    }

    @Override
    public boolean supportsDryRun() {
        return true;
    }

    @Override
    public Mono<ActionResult> dryRun(ActionContext context) {
        String desired = desiredValue.apply(context);
        return controlPlane.snapshot(context.getResourceKey())
                .map(state -> Objects.equals(state.attribute(attribute), desired)
                        ? ActionResult.noOp("would leave " + attribute + " at " + desired)
                        : ActionResult.noOp("would set " + attribute + " " + state.attribute(attribute)
                        + " -> " + desired));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
