package com.z254.lazarus.remediation;

import com.z254.lazarus.action.ActionContext;
import com.z254.lazarus.action.ActionKind;
import com.z254.lazarus.action.ActionRegistry;
import com.z254.lazarus.action.ActionResult;
import com.z254.lazarus.action.ControlPlane;
import com.z254.lazarus.action.RemediationAction;
import com.z254.lazarus.action.ResourceState;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.StepResult;
import com.z254.lazarus.domain.model.StepStatus;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.RemediationEventType;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs one attempt of a playbook against an incident's resource.
 * <p>
 * Execution flow per step:
 * <ol>
 *     <li>Renew the resource lock lease</li>
 *     <li>Run the action, bounded by the step timeout and the operator abort signal</li>
 *     <li>Verify the effect, when the step declares verify</li>
 *     <li>On timeout, abort, action error or failed verification, roll back when declared</li>
 * </ol>
 * The first failing step ends the attempt, and the steps it already applied are rolled back in
 * reverse order so the resource returns to its state before the attempt. Failures are returned as {@link StepError} values;
 * the caller decides about retries and escalation. The resource state hash is captured before
 * and after the attempt.
 */
@Slf4j
@Component
public class RemediationExecutor {

    private final ActionRegistry actionRegistry;
    private final ControlPlane controlPlane;
    private final AuditLedger auditLedger;
    private final RemediationMetrics metrics;
    private final LazarusStructuredLogger structuredLogger;

    public RemediationExecutor(ActionRegistry actionRegistry,
                               ControlPlane controlPlane,
                               AuditLedger auditLedger,
                               RemediationMetrics metrics,
                               LazarusStructuredLogger structuredLogger) {
        this.actionRegistry = actionRegistry;
        this.controlPlane = controlPlane;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Execute the playbook's steps in order and return the attempt's record. Never errors for
     * step failures; those are reported through {@link ExecutionRecord#getFailure()}.
     */
    public Mono<ExecutionRecord> execute(Incident incident, Playbook playbook, ExecutionOptions options) {
        return Mono.defer(() -> {
            ExecutionRecord record = ExecutionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .incidentId(incident.getId())
                    .resourceKey(incident.getResourceKey())
                    .playbookId(playbook.getId())
                    .playbookVersion(playbook.getVersion())
                    .attempt(options.getAttempt())
                    .dryRun(options.isDryRun())
                    .startedAt(Instant.now())
                    .build();

            structuredLogger.logRemediationEvent(incident.getId(), playbook.getId(),
                    options.isDryRun() ? RemediationEventType.DRY_RUN : RemediationEventType.ATTEMPT_STARTED,
                    "Executing " + playbook.ref() + " on " + incident.getResourceKey(),
                    Map.of("attempt", options.getAttempt(), "steps", playbook.getSteps().size()));

            return stateHash(incident.getResourceKey())
                    .flatMap(preHash -> {
                        record.setPreStateHash(preHash);
                        return Flux.fromIterable(playbook.getSteps())
                                .concatMap(step -> runStep(incident, step, options))
                                .takeUntil(StepOutcome::isFailure)
                                .collectList();
                    })
                    .flatMap(outcomes -> unwind(incident, outcomes))
                    .flatMap(outcomes -> stateHash(incident.getResourceKey())
                            .map(postHash -> complete(record, outcomes, postHash)));
        });
    }

    // ========== Private Methods ==========

    /**
     * After a failed step, roll back the earlier steps of the attempt, last applied first. An error
     * stops the unwinding and turns the attempt's failure into {@link StepErrorKind#ROLLBACK_FAILED}.
     * Nothing is unwound when the failing step's own rollback already failed.
     */
    private Mono<List<StepOutcome>> unwind(Incident incident, List<StepOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return Mono.just(outcomes);
        }
        StepOutcome last = outcomes.get(outcomes.size() - 1);
        if (!last.isFailure() || last.error().isFatal()) {
            return Mono.just(outcomes);
        }
        List<StepOutcome> applied = new ArrayList<>(outcomes.subList(0, outcomes.size() - 1));
        Collections.reverse(applied);
        return Flux.fromIterable(applied)
                .filter(StepOutcome::isReversible)
                .concatMap(outcome -> outcome.undo().doOnSuccess(done -> outcome.result().setRolledBack(true)))
                .then(Mono.just(outcomes))
                .onErrorResume(rollbackError -> {
                    StepError fatal = new StepError(StepErrorKind.ROLLBACK_FAILED,
                            last.error().kind() + " then rollback of an earlier step failed: " + describe(rollbackError));
                    auditStepFailure(incident, last.result(), fatal);
                    last.result().setError(fatal);
                    last.result().setDetail(fatal.message());
                    List<StepOutcome> unwound = new ArrayList<>(outcomes.subList(0, outcomes.size() - 1));
                    unwound.add(StepOutcome.failure(last.result(), fatal));
                    return Mono.just(unwound);
                });
    }

    private ExecutionRecord complete(ExecutionRecord record, List<StepOutcome> outcomes, String postHash) {
        outcomes.forEach(outcome -> record.getStepResults().add(outcome.result()));
        StepError failure = outcomes.stream()
                .map(StepOutcome::error)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        record.setFailure(failure);
        record.setSuccess(failure == null);
        record.setAborted(failure != null && failure.kind() == StepErrorKind.ABORTED);
        record.setPostStateHash(postHash);
        record.setChanged(!Objects.equals(record.getPreStateHash(), postHash));
        record.setCompletedAt(Instant.now());

        structuredLogger.logRemediationEvent(record.getIncidentId(), record.getPlaybookId(),
                failure == null ? RemediationEventType.ATTEMPT_SUCCEEDED : RemediationEventType.ATTEMPT_FAILED,
                "Attempt " + record.getAttempt() + (failure == null ? " succeeded" : " failed"),
                attemptDetails(record));
        return record;
    }

    private Mono<StepOutcome> runStep(Incident incident, PlaybookStep step, ExecutionOptions options) {
        RemediationAction action = actionRegistry.get(step.getActionKind());
        ActionContext context = ActionContext.builder()
                .incidentId(incident.getId())
                .resourceKey(incident.getResourceKey())
                .parameters(step.getParameters())
                .build();
        Instant startedAt = Instant.now();

        if (options.isDryRun()) {
            return dryRunStep(step, action, context, startedAt);
        }

        if (options.getLock() != null && !options.getLock().renew()) {
            log.warn("Lease of {} lost before step {}", options.getLock(), step.getOrder());
        }

        Mono<ActionResult> act = guarded(action.execute(context), step.getTimeout(), options.getAbortSignal());
        return act
                .flatMap(result -> verifyStep(step, action, context, options)
                        .flatMap(verified -> verified
                                ? Mono.just(succeeded(incident, step, action, context, startedAt, result))
                                : rollbackAndFail(incident, step, action, context, startedAt,
                                new StepError(StepErrorKind.VERIFICATION_FAILED,
                                        step.getActionKind().id() + " did not pass verification")))
                        .onErrorResume(error -> rollbackAndFail(incident, step, action, context, startedAt,
                                classify(error, StepErrorKind.VERIFICATION_FAILED))))
                .onErrorResume(error -> rollbackAndFail(incident, step, action, context, startedAt,
                        classify(error, StepErrorKind.STEP_FAILED)));
    }

    private StepOutcome succeeded(Incident incident, PlaybookStep step, RemediationAction action,
                                  ActionContext context, Instant startedAt, ActionResult result) {
        StepResult stepResult = stepResult(step, startedAt,
                result.changed() ? StepStatus.SUCCEEDED : StepStatus.NO_OP, result.detail(), null);
        if (!result.changed() || !step.isHasRollback()) {
            return StepOutcome.success(stepResult);
        }
        return StepOutcome.success(stepResult, rollback(incident, step, action, context));
    }

    private Mono<Boolean> verifyStep(PlaybookStep step, RemediationAction action, ActionContext context,
                                     ExecutionOptions options) {
        if (!step.isHasVerify()) {
            return Mono.just(true);
        }
        return guarded(action.verify(context), step.getTimeout(), options.getAbortSignal());
    }

    private Mono<StepOutcome> dryRunStep(PlaybookStep step, RemediationAction action, ActionContext context,
                                         Instant startedAt) {
        if (!step.isHasDryRun() || !action.supportsDryRun()) {
            return Mono.just(StepOutcome.success(stepResult(step, startedAt, StepStatus.SKIPPED,
                    "no dry run declared", null)));
        }
        return action.dryRun(context)
                .timeout(step.getTimeout())
                .map(result -> StepOutcome.success(stepResult(step, startedAt, StepStatus.DRY_RUN, result.detail(), null)))
                .onErrorResume(error -> {
                    StepError stepError = classify(error, StepErrorKind.STEP_FAILED);
                    return Mono.just(StepOutcome.failure(stepResult(step, startedAt, StepStatus.FAILED,
                            stepError.message(), stepError), stepError));
                });
    }

    /**
     * Roll the step back when it declares rollback, then report the step as failed. A rollback
     * that errors turns the failure into {@link StepErrorKind#ROLLBACK_FAILED}.
     */
    private Mono<StepOutcome> rollbackAndFail(Incident incident, PlaybookStep step, RemediationAction action,
                                              ActionContext context, Instant startedAt, StepError cause) {
        metrics.recordStepError(cause.kind().name());
        auditStepFailure(incident, step, cause);
        structuredLogger.logRemediationEvent(incident.getId(), null, RemediationEventType.STEP_FAILED,
                "Step " + step.getOrder() + " failed", Map.of("action", step.getActionKind().id(),
                        "errorKind", cause.kind().name(), "error", cause.message()));

        if (!step.isHasRollback()) {
            return Mono.just(StepOutcome.failure(stepResult(step, startedAt, StepStatus.FAILED, cause.message(), cause),
                    cause));
        }

        return rollback(incident, step, action, context)
                .then(Mono.fromCallable(() -> {
                    StepResult result = stepResult(step, startedAt, StepStatus.FAILED, cause.message(), cause);
                    result.setRolledBack(true);
                    return StepOutcome.failure(result, cause);
                }))
                .onErrorResume(rollbackError -> {
                    StepError fatal = new StepError(StepErrorKind.ROLLBACK_FAILED,
                            cause.kind() + " then rollback failed: " + describe(rollbackError));
                    StepResult result = stepResult(step, startedAt, StepStatus.FAILED, fatal.message(), fatal);
                    auditStepFailure(incident, result, fatal);
                    return Mono.just(StepOutcome.failure(result, fatal));
                });
    }

    /**
     * Deferred rollback of one step, audited and counted either way.
     */
    private Mono<Void> rollback(Incident incident, PlaybookStep step, RemediationAction action,
                                ActionContext context) {
        return Mono.defer(() -> action.rollback(context))
                .timeout(step.getTimeout())
                .doOnSuccess(done -> {
                    metrics.recordRollback(true);
                    auditLedger.append("executor", "step_rolled_back", Map.of(
                            "incidentId", incident.getId(),
                            "step", step.getOrder(),
                            "action", step.getActionKind().id(),
                            "restored", Map.copyOf(context.getCaptured())));
                    structuredLogger.logRemediationEvent(incident.getId(), null, RemediationEventType.ROLLED_BACK,
                            "Step " + step.getOrder() + " rolled back", Map.of("action", step.getActionKind().id()));
                })
                .doOnError(rollbackError -> {
                    metrics.recordRollback(false);
                    structuredLogger.logRemediationEvent(incident.getId(), null, RemediationEventType.ROLLBACK_FAILED,
                            "Rollback of step " + step.getOrder() + " failed",
                            Map.of("action", step.getActionKind().id(), "error", describe(rollbackError)));
                });
    }

    /**
     * Bound a step operation by its timeout and the abort signal. An abort surfaces as
     * {@link StepAbortedException}.
     */
    private <T> Mono<T> guarded(Mono<T> operation, Duration timeout, Mono<Void> abortSignal) {
        return operation
                .timeout(timeout)
                .takeUntilOther(abortSignal)
                .switchIfEmpty(Mono.error(new StepAbortedException()));
    }

    private StepError classify(Throwable error, StepErrorKind fallback) {
        if (error instanceof TimeoutException) {
            return new StepError(StepErrorKind.STEP_TIMEOUT, "timed out");
        }
        if (error instanceof StepAbortedException) {
            return new StepError(StepErrorKind.ABORTED, "aborted by operator");
        }
        return new StepError(fallback, describe(error));
    }

    private StepResult stepResult(PlaybookStep step, Instant startedAt, StepStatus status, String detail,
                                  StepError error) {
        return StepResult.builder()
                .order(step.getOrder())
                .actionKind(step.getActionKind())
                .status(status)
                .detail(detail)
                .error(error)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }

    private Mono<String> stateHash(String resourceKey) {
        return controlPlane.snapshot(resourceKey)
                .map(ResourceState::stateHash)
                .onErrorResume(error -> {
                    log.warn("Could not snapshot {}: {}", resourceKey, error.getMessage());
                    return Mono.just("unavailable");
                });
    }

    private void auditStepFailure(Incident incident, PlaybookStep step, StepError error) {
        auditStepFailure(incident, step.getOrder(), step.getActionKind(), error);
    }

    private void auditStepFailure(Incident incident, StepResult step, StepError error) {
        auditStepFailure(incident, step.getOrder(), step.getActionKind(), error);
    }

    private void auditStepFailure(Incident incident, int order, ActionKind actionKind, StepError error) {
        auditLedger.append("executor", "step_failed", Map.of(
                "incidentId", incident.getId(),
                "resourceKey", incident.getResourceKey(),
                "step", order,
                "action", actionKind.id(),
                "errorKind", error.kind().name(),
                "error", error.message()));
    }

    private Map<String, Object> attemptDetails(ExecutionRecord record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", record.getAttempt());
        details.put("dryRun", record.isDryRun());
        details.put("changed", record.isChanged());
        details.put("durationMs", record.getDuration().toMillis());
        if (record.getFailure() != null) {
            details.put("errorKind", record.getFailure().kind().name());
        }
        return details;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    /**
     * Signals that the abort signal fired while a step was running.
     */
    static final class StepAbortedException extends RuntimeException {
        StepAbortedException() {
            super("aborted", null, false, false);
        }
    }
}
