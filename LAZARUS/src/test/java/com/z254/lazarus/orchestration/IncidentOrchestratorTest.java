package com.z254.lazarus.orchestration;

import com.z254.lazarus.action.ActionContext;
import com.z254.lazarus.action.ActionKind;
import com.z254.lazarus.action.ActionRegistry;
import com.z254.lazarus.action.ActionResult;
import com.z254.lazarus.action.ControlPlaneException;
import com.z254.lazarus.action.InMemoryControlPlane;
import com.z254.lazarus.action.RemediationAction;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.audit.InMemoryAuditLedgerStore;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.IncidentStatus;
import com.z254.lazarus.domain.model.StepStatus;
import com.z254.lazarus.domain.repository.InMemoryIncidentRepository;
import com.z254.lazarus.domain.service.IncidentService;
import com.z254.lazarus.escalation.AutomationGuard;
import com.z254.lazarus.escalation.EscalationManager;
import com.z254.lazarus.escalation.EscalationReason;
import com.z254.lazarus.escalation.EscalationStateException;
import com.z254.lazarus.escalation.EscalationTicket;
import com.z254.lazarus.escalation.FallbackModeRegistry;
import com.z254.lazarus.governance.ChangeWindowGuard;
import com.z254.lazarus.governance.RemediationRateLimiter;
import com.z254.lazarus.lock.ResourceLockManager;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.MetricsPublisher;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.AutonomyTier;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookRegistry;
import com.z254.lazarus.playbook.PlaybookStep;
import com.z254.lazarus.playbook.TriggerPattern;
import com.z254.lazarus.remediation.BackoffPolicy;
import com.z254.lazarus.remediation.RemediationExecutor;
import com.z254.lazarus.remediation.StepErrorKind;
import com.z254.lazarus.trigger.FailureDispatcher;
import com.z254.lazarus.trigger.TriggerDecision;
import com.z254.lazarus.trigger.TriggerEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Drives the engine end to end, from dispatched failure to terminal incident, against the
 * in-memory control plane.
 */
class IncidentOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryControlPlane controlPlane;
    private ActionRegistry actionRegistry;
    private AuditLedger auditLedger;
    private IncidentService incidentService;
    private PlaybookRegistry playbookRegistry;
    private ResourceLockManager lockManager;
    private EscalationManager escalationManager;
    private AutomationGuard automationGuard;
    private FallbackModeRegistry fallbackModes;
    private ChangeWindowGuard changeWindowGuard;
    private MetricsPublisher metricsPublisher;
    private IncidentOrchestrator orchestrator;
    private FailureDispatcher dispatcher;
    private RemediationMetrics metrics;
    private LazarusStructuredLogger structuredLogger;
    private GatedRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        LazarusProperties properties = new LazarusProperties();
        properties.getTrigger().setCooldown(Duration.ZERO);
        structuredLogger = new LazarusStructuredLogger();
        metrics = new RemediationMetrics(new SimpleMeterRegistry());

        controlPlane = new InMemoryControlPlane();
        actionRegistry = new ActionRegistry(controlPlane);
        actionRegistry.register(new BrokenRollbackAction());
        auditLedger = new AuditLedger(new InMemoryAuditLedgerStore());
        incidentService = new IncidentService(new InMemoryIncidentRepository(), auditLedger, metrics,
                structuredLogger, List.of());
        playbookRegistry = new PlaybookRegistry(actionRegistry, auditLedger);
        lockManager = new ResourceLockManager(properties.getLock(), auditLedger, Clock.systemUTC());
        automationGuard = new AutomationGuard();
        fallbackModes = new FallbackModeRegistry();
        escalationManager = new EscalationManager(properties, auditLedger, fallbackModes, automationGuard,
                structuredLogger, List.of());
        changeWindowGuard = new ChangeWindowGuard(properties);
        metricsPublisher = new MetricsPublisher(properties, metrics, auditLedger);
        rateLimiter = new GatedRateLimiter();

        orchestrator = new IncidentOrchestrator(incidentService, playbookRegistry,
                new RemediationExecutor(actionRegistry, controlPlane, auditLedger, metrics, structuredLogger),
                lockManager, escalationManager, changeWindowGuard,
                rateLimiter,
                new BackoffPolicy(Duration.ofMillis(50), Duration.ofMillis(400), 0.0),
                metrics, metricsPublisher, auditLedger, structuredLogger);
        orchestrator.register();

        TriggerEngine triggerEngine = new TriggerEngine(playbookRegistry, incidentService, lockManager,
                automationGuard, escalationManager, auditLedger, metrics, metricsPublisher, structuredLogger, properties);
        dispatcher = new FailureDispatcher(triggerEngine, orchestrator);

        playbookRegistry.publish(playbook("storage_recovery", "storage_locked", "db.*", 2,
                step(ActionKind.RELEASE_STORAGE_LOCK, true, true)).build());
        playbookRegistry.publish(playbook("pool_reset", "pool_exhausted", "pool", 1,
                step(ActionKind.RESET_CONNECTION_POOL, true, false)).build());
        playbookRegistry.publish(playbook("guarded_restart", "service_unreachable", null, 1,
                step(ActionKind.RESTART_SERVICE, true, false)).requiresApproval(true).build());
        playbookRegistry.publish(playbook("manual_only", "disk_full", null, 1,
                step(ActionKind.NOTIFY_OPERATOR, false, false)).autonomyTier(AutonomyTier.HUMAN_MANDATORY).build());
        playbookRegistry.publish(playbook("load_shedding", "overload", null, 3,
                step(ActionKind.SHED_LOAD, true, true)).build());
        playbookRegistry.publish(playbook("cache_unlock", "cache_locked", "cache", 3,
                step(ActionKind.RELEASE_STORAGE_LOCK, true, true)).build());

        controlPlane.inject("db", Map.of(ActionRegistry.STORAGE_LOCK, "held"));
        controlPlane.inject("pool", Map.of(ActionRegistry.CONNECTION_POOL, "exhausted"));
        controlPlane.inject("api", Map.of(ActionRegistry.STATUS, "DOWN"));
        controlPlane.inject("cache", Map.of(ActionRegistry.STORAGE_LOCK, "held"));
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
        orchestrator.shutdown();
    }

    @Nested
    @DisplayName("automatic remediation")
    class Automatic {

        @Test
        void healableFailureIsResolvedAndLockReleased() {
            String id = open("db", "storage_locked");

            Incident resolved = awaitStatus(id, IncidentStatus.RESOLVED);

            assertThat(resolved.getAttemptCount()).isEqualTo(1);
            assertThat(resolved.getMttrSeconds())
                    .isEqualTo(Duration.between(resolved.getDetectedAt(), resolved.getResolvedAt()).toMillis() / 1000.0)
                    .isLessThan(60.0);
            assertThat(resolved.lastExecution().getMttrSeconds()).isEqualTo(resolved.getMttrSeconds());
            assertThat(controlPlane.list().get("db").attribute(ActionRegistry.STORAGE_LOCK)).isEqualTo("free");
            await().atMost(TIMEOUT).until(() -> lockManager.holder("db").isEmpty());
            assertThat(metricsPublisher.playbookStats("storage_recovery").orElseThrow().getResolved()).isEqualTo(1);
            assertThat(auditLedger.verify().valid()).isTrue();
        }

        @Test
        void transientStepFailureIsRetried() {
            controlPlane.failNextUpdates("db", 1);
            String id = open("db", "storage_locked");

            Incident resolved = awaitStatus(id, IncidentStatus.RESOLVED);

            assertThat(resolved.getAttemptCount()).isEqualTo(2);
            assertThat(resolved.getExecutions()).extracting(ExecutionRecord::isSuccess).containsExactly(false, true);
            assertThat(resolved.getExecutions().get(0).getFailure().kind()).isEqualTo(StepErrorKind.STEP_FAILED);
            assertThat(resolved.getTimeline()).extracting(Incident.TimelineEvent::getType)
                    .contains(Incident.TimelineEventType.RETRY_SCHEDULED);
        }

        @Test
        void exhaustedRetriesEscalateWithFallback() {
            controlPlane.pin("db", ActionRegistry.STORAGE_LOCK, "held");
            String id = open("db", "storage_locked");

            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);

            assertThat(escalated.getAttemptCount()).isEqualTo(2);
            assertThat(escalated.getExecutions()).hasSize(2)
                    .allSatisfy(record -> assertThat(record.getFailure().kind())
                            .isEqualTo(StepErrorKind.VERIFICATION_FAILED));
            EscalationTicket ticket = escalationManager.require(escalated.getEscalationTicketId());
            assertThat(ticket.getReason()).isEqualTo(EscalationReason.RETRY_EXHAUSTED);
            assertThat(fallbackModes.isEnabled("db")).isTrue();
            assertThat(automationGuard.isDisabled("db")).isFalse();
        }

        @Test
        void threeRetriesMeanThreeAttemptsWithGrowingPauses() {
            controlPlane.pin("cache", ActionRegistry.STORAGE_LOCK, "held");
            String id = open("cache", "cache_locked");

            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);

            List<ExecutionRecord> records = escalated.getExecutions();
            assertThat(records).hasSize(3);
            Duration firstPause = Duration.between(records.get(0).getCompletedAt(), records.get(1).getStartedAt());
            Duration secondPause = Duration.between(records.get(1).getCompletedAt(), records.get(2).getStartedAt());
            assertThat(firstPause).isGreaterThanOrEqualTo(Duration.ofMillis(50));
            assertThat(secondPause).isGreaterThanOrEqualTo(Duration.ofMillis(100)).isGreaterThan(firstPause);
            assertThat(escalationManager.require(escalated.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.RETRY_EXHAUSTED);
        }

        @Test
        void failedRollbackFailsIncidentAndSuppressesLaterFailures() {
            String id = open("shop", "overload");

            Incident failed = awaitStatus(id, IncidentStatus.FAILED);

            assertThat(failed.getAttemptCount()).isEqualTo(1);
            EscalationTicket ticket = escalationManager.require(failed.getEscalationTicketId());
            assertThat(ticket.getReason()).isEqualTo(EscalationReason.ROLLBACK_FAILED);
            assertThat(automationGuard.blockingTicket("shop")).contains(ticket.getId());

            TriggerDecision next = dispatch("shop", "overload");
            assertThat(next.outcome()).isEqualTo(TriggerDecision.Outcome.SUPPRESSED);
        }

        @Test
        void incidentsOfOneResourceRunOneAtATime() {
            controlPlane.delayUpdates("db", Duration.ofMillis(300));
            String first = open("db", "storage_locked");
            await().atMost(TIMEOUT).until(() -> orchestrator.isRunning(first));

            TriggerDecision second = dispatch("db", "storage_locked");

            assertThat(second.outcome()).isEqualTo(TriggerDecision.Outcome.OPENED);
            assertThat(second.isReadyToRemediate()).isFalse();
            Incident firstResolved = awaitStatus(first, IncidentStatus.RESOLVED);
            Incident secondResolved = awaitStatus(second.incidentId(), IncidentStatus.RESOLVED);
            assertThat(secondResolved.lastExecution().getStartedAt())
                    .isAfterOrEqualTo(firstResolved.lastExecution().getCompletedAt());
            assertThat(secondResolved.lastExecution().getStepResults().get(0).getStatus())
                    .isEqualTo(StepStatus.NO_OP);
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        void failuresDuringRemediationCoalesceWithoutNewAttempts() {
            LazarusProperties slowCooldown = new LazarusProperties();
            TriggerEngine engine = new TriggerEngine(playbookRegistry, incidentService, lockManager,
                    automationGuard, escalationManager, auditLedger, metrics, metricsPublisher, structuredLogger,
                    slowCooldown);
            FailureDispatcher coalescing = new FailureDispatcher(engine, orchestrator);
            try {
                controlPlane.delayUpdates("db", Duration.ofMillis(500));
                TriggerDecision first = coalescing.dispatch(failure("db", "storage_locked")).block(TIMEOUT);
                String id = first.incidentId();
                await().atMost(TIMEOUT).until(() -> orchestrator.isRunning(id));

                for (int i = 0; i < 5; i++) {
                    TriggerDecision repeat = coalescing.dispatch(failure("db", "storage_locked")).block(TIMEOUT);
                    assertThat(repeat.outcome()).isEqualTo(TriggerDecision.Outcome.COALESCED);
                    assertThat(repeat.incidentId()).isEqualTo(id);
                }
                assertThat(incidentService.require(id).getStatus())
                        .isIn(IncidentStatus.REMEDIATING, IncidentStatus.VERIFYING);

                Incident resolved = awaitStatus(id, IncidentStatus.RESOLVED);
                assertThat(resolved.getCoalescedCount()).isEqualTo(5);
                assertThat(resolved.getAttemptCount()).isEqualTo(1);
                assertThat(incidentService.history("db")).hasSize(1);
            } finally {
                coalescing.shutdown();
            }
        }

        @Test
        void distinctResourcesAreRemediatedInParallel() {
            controlPlane.delayUpdates("db", Duration.ofMillis(400));
            controlPlane.delayUpdates("pool", Duration.ofMillis(400));

            String onDb = open("db", "storage_locked");
            String onPool = open("pool", "pool_exhausted");

            ExecutionRecord db = awaitStatus(onDb, IncidentStatus.RESOLVED).lastExecution();
            ExecutionRecord pool = awaitStatus(onPool, IncidentStatus.RESOLVED).lastExecution();
            assertThat(db.getStartedAt()).isBefore(pool.getCompletedAt());
            assertThat(pool.getStartedAt()).isBefore(db.getCompletedAt());
        }
    }

    @Nested
    @DisplayName("governance")
    class Governance {

        @Test
        void approvalRequiredPlaybookWaitsForOperator() {
            String id = open("api", "service_unreachable");

            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);

            assertThat(escalated.getAttemptCount()).isZero();
            assertThat(escalationManager.require(escalated.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.APPROVAL_REQUIRED);
            assertThat(controlPlane.list().get("api").attribute(ActionRegistry.STATUS)).isEqualTo("DOWN");
        }

        @Test
        void approvalRunsFollowUpIncident() {
            String id = open("api", "service_unreachable");
            awaitStatus(id, IncidentStatus.ESCALATED);

            EscalationResolution resolution = orchestrator.approve(id, "alice");

            assertThat(resolution.ticket().isOpen()).isFalse();
            Incident followUp = awaitStatus(resolution.followUp().getId(), IncidentStatus.RESOLVED);
            assertThat(followUp.getParentIncidentId()).isEqualTo(id);
            assertThat(followUp.isApproved()).isTrue();
            assertThat(controlPlane.list().get("api").attribute(ActionRegistry.STATUS)).isEqualTo("UP");
            assertThat(incidentService.require(id).getStatus()).isEqualTo(IncidentStatus.ESCALATED);
        }

        @Test
        void humanMandatoryPlaybookIsNeverRunAndCannotBeApproved() {
            String id = open("disk", "disk_full");

            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);

            assertThat(escalationManager.require(escalated.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.HUMAN_MANDATORY);
            assertThatThrownBy(() -> orchestrator.approve(id, "alice"))
                    .isInstanceOf(EscalationStateException.class);
        }

        @Test
        void changeFreezeEscalatesWithoutRunning() {
            changeWindowGuard.addFreezePeriod(ChangeWindowGuard.FreezePeriod.builder()
                    .start(Instant.now().minus(Duration.ofHours(1)))
                    .end(Instant.now().plus(Duration.ofHours(1)))
                    .reason("release")
                    .build());
            String id = open("db", "storage_locked");

            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);

            assertThat(escalationManager.require(escalated.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.CHANGE_FREEZE);
            assertThat(controlPlane.list().get("db").attribute(ActionRegistry.STORAGE_LOCK)).isEqualTo("held");
        }

        @Test
        void hourlyRateLimitEscalates() {
            for (int i = 0; i < 3; i++) {
                controlPlane.inject("db", Map.of(ActionRegistry.STORAGE_LOCK, "held"));
                awaitStatus(open("db", "storage_locked"), IncidentStatus.RESOLVED);
            }
            controlPlane.inject("db", Map.of(ActionRegistry.STORAGE_LOCK, "held"));

            Incident limited = awaitStatus(open("db", "storage_locked"), IncidentStatus.ESCALATED);

            assertThat(escalationManager.require(limited.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.RATE_LIMITED);
        }

        @Test
        void retryResolutionOfTicketRunsOneMoreAttempt() {
            controlPlane.pin("db", ActionRegistry.STORAGE_LOCK, "held");
            String id = open("db", "storage_locked");
            Incident escalated = awaitStatus(id, IncidentStatus.ESCALATED);
            controlPlane.clearChaos("db");

            EscalationResolution resolution = orchestrator.resolveEscalation(escalated.getEscalationTicketId(),
                    "bob", EscalationTicket.Resolution.RETRY_REMEDIATION);

            assertThat(fallbackModes.isEnabled("db")).isFalse();
            Incident followUp = awaitStatus(resolution.followUp().getId(), IncidentStatus.RESOLVED);
            assertThat(followUp.getDetectedAt()).isEqualTo(escalated.getDetectedAt());
        }
    }

    @Nested
    @DisplayName("operator abort")
    class Abort {

        @Test
        void runningAttemptIsAbortedAndEscalated() {
            controlPlane.delayUpdates("pool", Duration.ofSeconds(1));
            String id = open("pool", "pool_exhausted");
            await().atMost(TIMEOUT).until(() -> orchestrator.isRunning(id));

            Incident aborted = orchestrator.abort(id, "carol").block(TIMEOUT);

            assertThat(aborted.getStatus()).isEqualTo(IncidentStatus.ESCALATED);
            assertThat(aborted.lastExecution().isAborted()).isTrue();
            assertThat(escalationManager.require(aborted.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.OPERATOR_ABORT);
            await().atMost(TIMEOUT).until(() -> lockManager.holder("pool").isEmpty());
        }

        @Test
        void queuedIncidentLeavesQueueOnAbort() {
            controlPlane.delayUpdates("db", Duration.ofMillis(500));
            String first = open("db", "storage_locked");
            await().atMost(TIMEOUT).until(() -> orchestrator.isRunning(first));
            String waiting = dispatch("db", "storage_locked").incidentId();

            Incident aborted = orchestrator.abort(waiting, "carol").block(TIMEOUT);

            assertThat(aborted.getStatus()).isEqualTo(IncidentStatus.ESCALATED);
            assertThat(aborted.getAttemptCount()).isZero();
            assertThat(lockManager.queued("db")).doesNotContain(waiting);
            awaitStatus(first, IncidentStatus.RESOLVED);
        }

        @Test
        void abortDuringRetryGateStopsTheRetry() throws Exception {
            rateLimiter.holdCall(2);
            controlPlane.failNextUpdates("db", 1);
            String id = open("db", "storage_locked");
            assertThat(rateLimiter.entered.await(TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();

            CompletableFuture<Incident> aborted = orchestrator.abort(id, "carol").toFuture();
            rateLimiter.release.countDown();
            Incident escalated = aborted.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);

            assertThat(escalated.getStatus()).isEqualTo(IncidentStatus.ESCALATED);
            assertThat(escalationManager.require(escalated.getEscalationTicketId()).getReason())
                    .isEqualTo(EscalationReason.OPERATOR_ABORT);
            await().pollDelay(Duration.ofMillis(300)).atMost(TIMEOUT).untilAsserted(() -> {
                Incident incident = incidentService.require(id);
                assertThat(incident.getStatus()).isEqualTo(IncidentStatus.ESCALATED);
                assertThat(incident.getAttemptCount()).isEqualTo(1);
                assertThat(incident.getExecutions()).hasSize(1);
            });
            assertThat(controlPlane.list().get("db").attribute(ActionRegistry.STORAGE_LOCK)).isEqualTo("held");
            await().atMost(TIMEOUT).until(() -> lockManager.holder("db").isEmpty());
        }

        @Test
        void terminalIncidentCannotBeAborted() {
            String id = open("db", "storage_locked");
            awaitStatus(id, IncidentStatus.RESOLVED);

            assertThatThrownBy(() -> orchestrator.abort(id, "carol").block(TIMEOUT))
                    .hasMessageContaining("RESOLVED");
        }
    }

    @Test
    void dryRunReportsWithoutTouchingResource() {
        ExecutionRecord record = orchestrator.dryRun("storage_recovery", "db").block(TIMEOUT);

        assertThat(record.isDryRun()).isTrue();
        assertThat(controlPlane.list().get("db").attribute(ActionRegistry.STORAGE_LOCK)).isEqualTo("held");
        assertThat(incidentService.history("db")).isEmpty();
        assertThat(lockManager.holder("db")).isEmpty();
    }

    // ========== Private Methods ==========

    private String open(String resourceKey, String kind) {
        TriggerDecision decision = dispatch(resourceKey, kind);
        assertThat(decision.outcome()).isEqualTo(TriggerDecision.Outcome.OPENED);
        return decision.incidentId();
    }

    private TriggerDecision dispatch(String resourceKey, String kind) {
        return dispatcher.dispatch(failure(resourceKey, kind)).block(TIMEOUT);
    }

    private static Failure failure(String resourceKey, String kind) {
        return Failure.builder()
                .detectorId("test")
                .resourceKey(resourceKey)
                .kind(kind)
                .build();
    }

    private Incident awaitStatus(String incidentId, IncidentStatus status) {
        await().atMost(TIMEOUT).until(() -> incidentService.require(incidentId).getStatus() == status);
        return incidentService.require(incidentId);
    }

    private static Playbook.PlaybookBuilder playbook(String id, String kind, String resource, int maxRetries,
                                                     PlaybookStep step) {
        return Playbook.builder()
                .id(id)
                .name(id)
                .version(1)
                .triggerPattern(TriggerPattern.of(kind, resource, null, null))
                .maxRetries(maxRetries)
                .steps(List.of(step));
    }

    private static PlaybookStep step(ActionKind kind, boolean verify, boolean rollback) {
        return PlaybookStep.builder()
                .order(1)
                .actionKind(kind)
                .timeout(Duration.ofSeconds(3))
                .hasVerify(verify)
                .hasRollback(rollback)
                .build();
    }

    /**
     * Rate limiter that can hold one chosen call until the test releases it.
     */
    private static class GatedRateLimiter extends RemediationRateLimiter {

        private final AtomicInteger calls = new AtomicInteger();
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile int heldCall;

        GatedRateLimiter() {
            super(3, Clock.systemUTC());
        }

        void holdCall(int call) {
            heldCall = call;
        }

        @Override
        public boolean tryAcquire(String resourceKey) {
            if (calls.incrementAndGet() == heldCall) {
                entered.countDown();
                try {
                    release.await(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.tryAcquire(resourceKey);
        }
    }

    /**
     * Load shedding that never takes effect and cannot be undone.
     */
    private static class BrokenRollbackAction implements RemediationAction {

        @Override
        public ActionKind kind() {
            return ActionKind.SHED_LOAD;
        }

        @Override
        public Mono<ActionResult> execute(ActionContext context) {
            return Mono.just(ActionResult.changed("load shedding requested"));
        }

        @Override
        public boolean supportsVerify() {
            return true;
        }

        @Override
        public Mono<Boolean> verify(ActionContext context) {
            return Mono.just(false);
        }

        @Override
        public boolean supportsRollback() {
            return true;
        }

        @Override
        public Mono<Void> rollback(ActionContext context) {
            return Mono.error(new ControlPlaneException("shedding switch stuck"));
        }
    }
}
