package com.z254.lazarus.trigger;

import com.z254.lazarus.domain.model.Failure;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for failures from every source.
 * <p>
 * Failures are grouped by resource key: failures of one key are evaluated strictly in submission
 * order, while different keys are evaluated in parallel on the trigger scheduler. A key's group
 * is closed once it has been idle for a while and reopened by its next failure, so resources that
 * failed once do not hold a group forever.
 */
@Slf4j
@Component
public class FailureDispatcher {

    private static final Duration EMIT_TIMEOUT = Duration.ofSeconds(1);
    static final Duration IDLE_GROUP_TIMEOUT = Duration.ofMinutes(5);

    private final TriggerEngine triggerEngine;
    private final FailureHandler failureHandler;
    private final Scheduler scheduler = Schedulers.newBoundedElastic(
            Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "lazarus-trigger");
    private final Sinks.Many<Submission> submissions = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicInteger openGroups = new AtomicInteger();
    private final Disposable subscription;
    private volatile boolean shuttingDown;

    @Autowired
    public FailureDispatcher(TriggerEngine triggerEngine, FailureHandler failureHandler) {
        this(triggerEngine, failureHandler, IDLE_GROUP_TIMEOUT);
    }

    FailureDispatcher(TriggerEngine triggerEngine, FailureHandler failureHandler, Duration idleGroupTimeout) {
        this.triggerEngine = triggerEngine;
        this.failureHandler = failureHandler;
        this.subscription = submissions.asFlux()
                .groupBy(submission -> submission.failure().getResourceKey())
                .flatMap(group -> group
                        .timeout(idleGroupTimeout, Mono.empty())
                        .concatMap(this::process, Integer.MAX_VALUE)
                        .doOnSubscribe(s -> openGroups.incrementAndGet())
                        .doFinally(signal -> {
                            openGroups.decrementAndGet();
                            log.debug("Closed idle failure group of {}", group.key());
                        }), Integer.MAX_VALUE)
                .doOnDiscard(Submission.class, this::resubmit)
                .subscribe();
    }

    /**
     * Queue a failure for evaluation.
     *
     * @return the decision, once the failure was evaluated and handed to the handler
     */
    public Mono<TriggerDecision> dispatch(Failure failure) {
        Sinks.One<TriggerDecision> result = Sinks.one();
        submissions.emitNext(new Submission(failure, result), Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
        return result.asMono();
    }

    /**
     * Number of resource keys with an open evaluation group.
     */
    public int openGroups() {
        return openGroups.get();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        subscription.dispose();
        scheduler.dispose();
    }

    // ========== Private Methods ==========

    /**
     * A failure that reached a group just as it closed is queued again and lands in a fresh group.
     */
    private void resubmit(Submission submission) {
        if (shuttingDown) {
            submission.result().tryEmitError(new IllegalStateException("Failure dispatcher is shut down"));
            return;
        }
        log.debug("Requeueing failure {} of {}", submission.failure().getId(), submission.failure().getResourceKey());
        scheduler.schedule(() -> submissions.emitNext(submission, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT)));
    }

    private Mono<Void> process(Submission submission) {
        return Mono.fromCallable(() -> {
                    TriggerDecision decision = triggerEngine.evaluate(submission.failure());
                    failureHandler.onDecision(decision);
                    return decision;
                })
                .subscribeOn(scheduler)
                .doOnNext(decision -> submission.result().tryEmitValue(decision))
                .doOnError(error -> {
                    log.error("Failed to evaluate failure {} on {}", submission.failure().getId(),
                            submission.failure().getResourceKey(), error);
                    submission.result().tryEmitError(error);
                })
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    private record Submission(Failure failure, Sinks.One<TriggerDecision> result) {
    }
}
