package com.z254.lazarus.orchestration;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.IllegalIncidentTransitionException;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.IncidentStatus;
import com.z254.lazarus.domain.model.Severity;
import com.z254.lazarus.domain.service.IncidentService;
import com.z254.lazarus.escalation.EscalationManager;
import com.z254.lazarus.escalation.EscalationReason;
import com.z254.lazarus.escalation.EscalationStateException;
import com.z254.lazarus.escalation.EscalationTicket;
import com.z254.lazarus.governance.ChangeWindowGuard;
import com.z254.lazarus.governance.RemediationRateLimiter;
import com.z254.lazarus.lock.Admission;
import com.z254.lazarus.lock.LockGrantListener;
import com.z254.lazarus.lock.LockResult;
import com.z254.lazarus.lock.ResourceLock;
import com.z254.lazarus.lock.ResourceLockManager;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.IncidentEventType;
import com.z254.lazarus.observability.LazarusStructuredLogger.RemediationEventType;
import com.z254.lazarus.observability.MetricsPublisher;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.AutonomyTier;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookRegistry;
import com.z254.lazarus.remediation.BackoffPolicy;
import com.z254.lazarus.remediation.ExecutionOptions;
import com.z254.lazarus.remediation.RemediationExecutor;
import com.z254.lazarus.trigger.FailureHandler;
import com.z254.lazarus.trigger.TriggerDecision;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives incidents from admission to a terminal state.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Governance gate in ANALYZING: approval, autonomy tier, change freeze, rate limit</li>
 *     <li>Remediation attempts under the resource lock, retried with backoff up to the playbook's bound</li>
 *     <li>Escalation on exhaustion, and FAILED with a critical ticket on rollback failure</li>
 *     <li>Operator operations: abort, approve, ticket resolution and dry runs</li>
 * </ul>
 * Attempts run on the remediation scheduler; the lock is released between attempts so that a
 * retry queues behind nothing but the incidents admitted before it.
 */
@Slf4j
@Service
public class IncidentOrchestrator implements FailureHandler, LockGrantListener {

    private static final String ACTOR = "orchestrator";

    private final IncidentService incidentService;
    private final PlaybookRegistry playbookRegistry;
    private final RemediationExecutor executor;
    private final ResourceLockManager lockManager;
    private final EscalationManager escalationManager;
    private final ChangeWindowGuard changeWindowGuard;
    private final RemediationRateLimiter rateLimiter;
    private final BackoffPolicy backoffPolicy;
    private final RemediationMetrics metrics;
    private final MetricsPublisher metricsPublisher;
    private final AuditLedger auditLedger;
    private final LazarusStructuredLogger structuredLogger;

    private final Scheduler remediationScheduler = Schedulers.newBoundedElastic(
            Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
            "lazarus-remediation");
    private final Map<String, RunningAttempt> running = new ConcurrentHashMap<>();
    private final Map<String, Disposable> pendingRetries = new ConcurrentHashMap<>();

    public IncidentOrchestrator(IncidentService incidentService,
                                PlaybookRegistry playbookRegistry,
                                RemediationExecutor executor,
                                ResourceLockManager lockManager,
                                EscalationManager escalationManager,
                                ChangeWindowGuard changeWindowGuard,
                                RemediationRateLimiter rateLimiter,
                                BackoffPolicy backoffPolicy,
                                RemediationMetrics metrics,
                                MetricsPublisher metricsPublisher,
                                AuditLedger auditLedger,
                                LazarusStructuredLogger structuredLogger) {
        this.incidentService = incidentService;
        this.playbookRegistry = playbookRegistry;
        this.executor = executor;
        this.lockManager = lockManager;
        this.escalationManager = escalationManager;
        this.changeWindowGuard = changeWindowGuard;
        this.rateLimiter = rateLimiter;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.metricsPublisher = metricsPublisher;
        this.auditLedger = auditLedger;
        this.structuredLogger = structuredLogger;
    }

    @PostConstruct
    public void register() {
        lockManager.setGrantListener(this);
    }

    @PreDestroy
    public void shutdown() {
        pendingRetries.values().forEach(Disposable::dispose);
        remediationScheduler.dispose();
    }

    @Override
    public void onDecision(TriggerDecision decision) {
        if (decision.isReadyToRemediate()) {
            submit(decision.incidentId(), decision.lockResult().lock(), () -> analyze(decision.incidentId(),
                    decision.lockResult().lock()));
        }
    }

    @Override
    public void onLockGranted(ResourceLock lock) {
        Incident incident = incidentService.get(lock.getIncidentId()).orElse(null);
        if (incident == null || !incident.isActive()) {
            log.debug("Granted lock {} belongs to no active incident, releasing", lock);
            lock.close();
            return;
        }
        switch (incident.getStatus()) {
            case DETECTED -> submit(incident.getId(), lock, () -> analyze(incident.getId(), lock));
            case REMEDIATING -> submit(incident.getId(), lock, () -> retry(incident.getId(), lock));
            default -> {
                log.warn("Lock granted to incident {} in unexpected status {}", incident.getId(), incident.getStatus());
                lock.close();
            }
        }
    }

    /**
     * Cancel an incident's remediation. A running attempt is cancelled at its current step, which
     * is rolled back when it declares rollback; a waiting incident leaves its queue or backoff.
     * Either way the incident ends ESCALATED with reason {@link EscalationReason#OPERATOR_ABORT}.
     *
     * @return the incident once it is escalated
     */
    public Mono<Incident> abort(String incidentId, String actor) {
        return Mono.defer(() -> {
            Incident incident = incidentService.require(incidentId);
            if (incident.getStatus().isTerminal()) {
                return Mono.error(new IllegalIncidentTransitionException(incidentId, incident.getStatus(),
                        IncidentStatus.ESCALATED));
            }
            auditLedger.append(actor, "abort_requested", Map.of(
                    "incidentId", incidentId,
                    "resourceKey", incident.getResourceKey(),
                    "status", incident.getStatus().name()));

            if (running.containsKey(incidentId)) {
                return abortOrEscalate(incident, actor);
            }
            return Mono.fromCallable(() -> abortOrEscalate(incident, actor))
                    .subscribeOn(remediationScheduler)
                    .flatMap(Function.identity());
        });
    }

    /**
     * Approve remediation of an incident that escalated because its playbook requires approval.
     * The approval ticket is resolved and an approved follow-up incident runs the playbook.
     *
     * @throws EscalationStateException if the incident has no open approval ticket
     */
    public EscalationResolution approve(String incidentId, String approver) {
        Incident incident = incidentService.require(incidentId);
        EscalationTicket ticket = escalationManager.findOpenForIncident(incidentId)
                .filter(t -> t.getReason() == EscalationReason.APPROVAL_REQUIRED)
                .orElseThrow(() -> new EscalationStateException(
                        "Incident " + incidentId + " has no open approval ticket"));

        EscalationTicket resolved = escalationManager.resolve(ticket.getId(), approver,
                EscalationTicket.Resolution.RETRY_REMEDIATION);
        incidentService.note(incidentId, Incident.TimelineEventType.APPROVED, approver,
                "Remediation approved by " + approver);
        structuredLogger.logIncidentEvent(incidentId, incident.getResourceKey(), IncidentEventType.APPROVED,
                "Remediation approved", Map.of("approver", approver, "ticketId", ticket.getId()));
        return new EscalationResolution(resolved, startFollowUp(incident, approver, true));
    }

    /**
     * Resolve an escalation ticket. {@code RETRY_REMEDIATION} opens a follow-up incident that gets
     * one more remediation run; an approval ticket resolved this way counts as approval.
     */
    public EscalationResolution resolveEscalation(String ticketId, String resolvedBy,
                                                  EscalationTicket.Resolution resolution) {
        EscalationTicket ticket = escalationManager.resolve(ticketId, resolvedBy, resolution);
        if (resolution != EscalationTicket.Resolution.RETRY_REMEDIATION) {
            return new EscalationResolution(ticket, null);
        }
        Incident parent = incidentService.require(ticket.getIncidentId());
        boolean approval = ticket.getReason() == EscalationReason.APPROVAL_REQUIRED;
        return new EscalationResolution(ticket, startFollowUp(parent, resolvedBy, approval));
    }

    /**
     * Run only the dry-run checks of a playbook's latest version against a resource. No incident is
     * created and the resource lock is not taken.
     */
    public Mono<ExecutionRecord> dryRun(String playbookId, String resourceKey) {
        return Mono.defer(() -> {
            Playbook playbook = playbookRegistry.get(playbookId)
                    .orElseThrow(() -> new NotFoundException("Playbook", playbookId));
            Incident probe = Incident.builder()
                    .id("dry-run-" + UUID.randomUUID())
                    .resourceKey(resourceKey)
                    .kind("dry_run")
                    .severity(Severity.LOW)
                    .detectedAt(Instant.now())
                    .playbookId(playbook.getId())
                    .playbookVersion(playbook.getVersion())
                    .build();
            return executor.execute(probe, playbook, ExecutionOptions.dryRun())
                    .doOnNext(record -> auditLedger.append("api", "dry_run_executed", Map.of(
                            "playbookId", playbook.getId(),
                            "playbookVersion", playbook.getVersion(),
                            "resourceKey", resourceKey,
                            "success", record.isSuccess())));
        });
    }

    /**
     * Whether an attempt of the incident is executing its steps.
     */
    public boolean isRunning(String incidentId) {
        RunningAttempt attempt = running.get(incidentId);
        return attempt != null && attempt.started().get();
    }

    // ========== Private Methods ==========

    private void submit(String incidentId, ResourceLock lock, Supplier<Mono<Void>> work) {
        Mono.defer(work)
                .subscribeOn(remediationScheduler)
                .subscribe(null, error -> {
                    log.error("Remediation of incident {} stopped on an unexpected error", incidentId, error);
                    auditLedger.append(ACTOR, "orchestration_error", Map.of(
                            "incidentId", incidentId,
                            "error", String.valueOf(error.getMessage())));
                    RunningAttempt attempt;
                    synchronized (running) {
                        attempt = running.remove(incidentId);
                    }
                    if (attempt != null) {
                        attempt.done().tryEmitError(error);
                    }
                    lock.close();
                });
    }

    /**
     * Signal the incident's registered attempt, or escalate the incident right away when it is
     * waiting for its lock or its backoff. Attempts register under the same monitor, so one of the
     * two always sees the other.
     */
    private Mono<Incident> abortOrEscalate(Incident incident, String actor) {
        String incidentId = incident.getId();
        RunningAttempt attempt;
        synchronized (running) {
            attempt = running.get(incidentId);
            if (attempt == null) {
                cancelPendingRetry(incidentId);
                lockManager.cancel(incident.getResourceKey(), incidentId);
                return Mono.just(escalateWaiting(incidentId, actor));
            }
            attempt.abortedBy().compareAndSet(null, actor);
        }
        attempt.abort().tryEmitEmpty();
        return attempt.done().asMono();
    }

    /**
     * First run of a freshly admitted incident: governance gate, then the first attempt.
     */
    private Mono<Void> analyze(String incidentId, ResourceLock lock) {
        RunningAttempt attempt = register(incidentId);
        if (attempt == null) {
            lock.close();
            return Mono.empty();
        }
        Incident incident = incidentService.transition(incidentId, IncidentStatus.ANALYZING, ACTOR,
                "Evaluating remediation");
        Playbook playbook = playbookOf(incident);

        GateResult gate = governanceGate(incident, playbook, true);
        if (gate != null) {
            finish(incidentId, attempt, escalate(incidentId, gate.reason(), playbook, gate.detail()));
            lock.close();
            return Mono.empty();
        }
        if (abortedBeforeStart(incidentId, playbook, attempt, lock)) {
            return Mono.empty();
        }

        incidentService.transition(incidentId, IncidentStatus.REMEDIATING, ACTOR, "Running " + playbook.ref());
        return attempt(incidentId, playbook, lock, attempt);
    }

    /**
     * Later attempt of an incident that re-acquired its lock after backoff.
     */
    private Mono<Void> retry(String incidentId, ResourceLock lock) {
        RunningAttempt attempt = register(incidentId);
        if (attempt == null) {
            lock.close();
            return Mono.empty();
        }
        Incident incident = incidentService.require(incidentId);
        Playbook playbook = playbookOf(incident);

        GateResult gate = governanceGate(incident, playbook, false);
        if (gate != null) {
            finish(incidentId, attempt, escalate(incidentId, gate.reason(), playbook, gate.detail()));
            lock.close();
            return Mono.empty();
        }
        return attempt(incidentId, playbook, lock, attempt);
    }

    /**
     * Make the incident's coming attempt visible to {@link #abort}. Returns null when the incident
     * is no longer active, i.e. it was aborted while waiting for its lock or its backoff.
     */
    private RunningAttempt register(String incidentId) {
        synchronized (running) {
            if (!incidentService.require(incidentId).isActive()) {
                log.debug("Incident {} left remediation before its attempt started", incidentId);
                return null;
            }
            RunningAttempt attempt = new RunningAttempt(Sinks.empty(), Sinks.one(), new AtomicReference<>(),
                    new AtomicBoolean());
            running.put(incidentId, attempt);
            return attempt;
        }
    }

    private void finish(String incidentId, RunningAttempt attempt, Incident incident) {
        synchronized (running) {
            running.remove(incidentId, attempt);
        }
        attempt.done().tryEmitValue(incident);
    }

    /**
     * Escalate instead of running when an abort arrived during the governance gate.
     */
    private boolean abortedBeforeStart(String incidentId, Playbook playbook, RunningAttempt attempt,
                                       ResourceLock lock) {
        String abortedBy = attempt.abortedBy().get();
        if (abortedBy == null) {
            return false;
        }
        structuredLogger.logRemediationEvent(incidentId, playbook.getId(), RemediationEventType.ABORTED,
                "Aborted before the attempt started", Map.of("actor", abortedBy));
        finish(incidentId, attempt, escalate(incidentId, EscalationReason.OPERATOR_ABORT, playbook,
                "Aborted by " + abortedBy));
        lock.close();
        return true;
    }

    private Mono<Void> attempt(String incidentId, Playbook playbook, ResourceLock lock, RunningAttempt attempt) {
        if (abortedBeforeStart(incidentId, playbook, attempt, lock)) {
            return Mono.empty();
        }
        OptionalInt attemptNo = incidentService.beginAttempt(incidentId);
        Incident incident = incidentService.require(incidentId);
        if (attemptNo.isEmpty()) {
            log.warn("Incident {} is {}, attempt dropped", incidentId, incident.getStatus());
            finish(incidentId, attempt, incident);
            lock.close();
            return Mono.empty();
        }

        ExecutionOptions options = ExecutionOptions.builder()
                .attempt(attemptNo.getAsInt())
                .lock(lock)
                .abortSignal(attempt.abort().asMono())
                .build();
        Timer.Sample sample = metrics.startAttempt();
        attempt.started().set(true);

        return executor.execute(incident, playbook, options)
                .publishOn(remediationScheduler)
                .doOnNext(record -> {
                    metrics.recordAttempt(sample, playbook.getId(), incident.getKind(), record.isSuccess());
                    metricsPublisher.recordAttempt(playbook.getId(), incident.getKind(), record.isSuccess());
                    finish(incidentId, attempt, conclude(incidentId, playbook, record, lock, attempt));
                })
                .then();
    }

    /**
     * Settle an attempt: resolve, schedule a retry or escalate.
     */
    private Incident conclude(String incidentId, Playbook playbook, ExecutionRecord record, ResourceLock lock,
                              RunningAttempt attempt) {
        incidentService.recordExecution(incidentId, record);
        Incident incident = incidentService.transition(incidentId, IncidentStatus.VERIFYING, ACTOR,
                record.isSuccess() ? "Attempt " + record.getAttempt() + " verified"
                        : "Attempt " + record.getAttempt() + " failed: " + record.getFailure().kind());

        if (record.isSuccess()) {
            Incident resolved = incidentService.resolve(incidentId);
            metricsPublisher.recordResolution(playbook.getId(), resolved.getKind(),
                    Duration.ofMillis(Math.round(resolved.getMttrSeconds() * 1000)));
            lock.close();
            return resolved;
        }

        String detail = record.getFailure().kind() + ": " + record.getFailure().message();
        if (record.isRollbackFailed()) {
            EscalationTicket ticket = escalationManager.escalate(incident, EscalationReason.ROLLBACK_FAILED,
                    playbook, detail);
            Incident failed = incidentService.fail(incidentId, ticket.getId(), detail);
            lock.close();
            return failed;
        }
        if (record.isAborted() || attempt.abortedBy().get() != null) {
            structuredLogger.logRemediationEvent(incidentId, playbook.getId(), RemediationEventType.ABORTED,
                    "Attempt aborted by operator", Map.of("attempt", record.getAttempt()));
            Incident escalated = escalate(incidentId, EscalationReason.OPERATOR_ABORT, playbook, detail);
            lock.close();
            return escalated;
        }
        if (record.getAttempt() >= playbook.getMaxRetries()) {
            Incident escalated = escalate(incidentId, EscalationReason.RETRY_EXHAUSTED, playbook,
                    record.getAttempt() + " attempts failed, last " + detail);
            lock.close();
            return escalated;
        }

        Duration delay = backoffPolicy.delayBefore(record.getAttempt() + 1);
        synchronized (running) {
            if (attempt.abortedBy().get() == null) {
                // from here on an abort finds the incident waiting and cancels its backoff
                running.remove(incidentId, attempt);
                Incident retrying = incidentService.transition(incidentId, IncidentStatus.REMEDIATING, ACTOR,
                        "Retry in " + delay.toMillis() + "ms");
                incidentService.note(incidentId, Incident.TimelineEventType.RETRY_SCHEDULED, ACTOR,
                        "Attempt " + (record.getAttempt() + 1) + " after " + delay.toMillis() + "ms");
                structuredLogger.logRemediationEvent(incidentId, playbook.getId(),
                        RemediationEventType.RETRY_SCHEDULED, "Retry scheduled",
                        Map.of("nextAttempt", record.getAttempt() + 1, "delayMs", delay.toMillis()));
                lock.close();
                scheduleRetry(incidentId, retrying.getResourceKey(), delay);
                return retrying;
            }
        }
        Incident escalated = escalate(incidentId, EscalationReason.OPERATOR_ABORT, playbook,
                "Aborted by " + attempt.abortedBy().get() + " after attempt " + record.getAttempt());
        lock.close();
        return escalated;
    }

    private void scheduleRetry(String incidentId, String resourceKey, Duration delay) {
        Disposable timer = Mono.delay(delay, remediationScheduler)
                .subscribe(tick -> {
                    pendingRetries.remove(incidentId);
                    readmit(incidentId, resourceKey);
                }, error -> log.error("Retry timer of incident {} failed", incidentId, error));
        pendingRetries.put(incidentId, timer);
        if (timer.isDisposed()) {
            pendingRetries.remove(incidentId, timer);
        }
    }

    private void cancelPendingRetry(String incidentId) {
        Disposable pending = pendingRetries.remove(incidentId);
        if (pending != null) {
            pending.dispose();
        }
    }

    private void readmit(String incidentId, String resourceKey) {
        Incident incident = incidentService.get(incidentId).orElse(null);
        if (incident == null || incident.getStatus() != IncidentStatus.REMEDIATING) {
            return;
        }
        LockResult result = lockManager.acquire(resourceKey, incidentId, Admission.RETRY);
        if (result.outcome() == LockResult.Outcome.ACQUIRED) {
            submit(incidentId, result.lock(), () -> retry(incidentId, result.lock()));
        } else {
            incidentService.note(incidentId, Incident.TimelineEventType.LOCK_QUEUED, ACTOR,
                    "Retry waiting for " + resourceKey + " at position " + result.position());
        }
    }

    private GateResult governanceGate(Incident incident, Playbook playbook, boolean firstAttempt) {
        if (firstAttempt) {
            if (playbook.getAutonomyTier() == AutonomyTier.HUMAN_MANDATORY) {
                return new GateResult(EscalationReason.HUMAN_MANDATORY,
                        playbook.ref() + " must be run by an operator");
            }
            if (playbook.needsApproval() && !incident.isApproved()) {
                return new GateResult(EscalationReason.APPROVAL_REQUIRED,
                        playbook.ref() + " requires approval");
            }
        }
        ChangeWindowGuard.WindowCheck window = changeWindowGuard.check();
        if (!window.isAllowed()) {
            return new GateResult(EscalationReason.CHANGE_FREEZE, window.getReason());
        }
        if (!rateLimiter.tryAcquire(incident.getResourceKey())) {
            return new GateResult(EscalationReason.RATE_LIMITED, "More than "
                    + rateLimiter.recentAttempts(incident.getResourceKey()) + " attempts on "
                    + incident.getResourceKey() + " in the last hour");
        }
        return null;
    }

    private Incident escalate(String incidentId, EscalationReason reason, Playbook playbook, String detail) {
        Incident incident = incidentService.require(incidentId);
        EscalationTicket ticket = escalationManager.escalate(incident, reason, playbook, detail);
        return incidentService.escalate(incidentId, ticket.getId(), reason.name());
    }

    private Incident escalateWaiting(String incidentId, String actor) {
        Incident incident = incidentService.require(incidentId);
        if (incident.getStatus() == IncidentStatus.DETECTED) {
            incidentService.transition(incidentId, IncidentStatus.ANALYZING, actor, "Aborted before remediation");
        }
        Playbook playbook = playbookRegistry.get(incident.getPlaybookId(), incident.getPlaybookVersion()).orElse(null);
        return escalate(incidentId, EscalationReason.OPERATOR_ABORT, playbook, "Aborted by " + actor);
    }

    private Incident startFollowUp(Incident parent, String actor, boolean approved) {
        Playbook playbook = playbookRegistry.get(parent.getPlaybookId())
                .orElseThrow(() -> new NotFoundException("Playbook", parent.getPlaybookId()));
        String incidentId = UUID.randomUUID().toString();
        AtomicReference<Incident> opened = new AtomicReference<>();
        LockResult result = lockManager.acquire(parent.getResourceKey(), incidentId, Admission.RETRY,
                () -> opened.set(incidentService.openFollowUp(incidentId, parent, playbook, approved, actor)));
        if (result.outcome() == LockResult.Outcome.ACQUIRED) {
            submit(incidentId, result.lock(), () -> analyze(incidentId, result.lock()));
        }
        return opened.get();
    }

    private Playbook playbookOf(Incident incident) {
        return playbookRegistry.get(incident.getPlaybookId(), incident.getPlaybookVersion())
                .orElseThrow(() -> new NotFoundException("Playbook",
                        incident.getPlaybookId() + "@v" + incident.getPlaybookVersion()));
    }

    // ========== Data Classes ==========

    private record RunningAttempt(Sinks.Empty<Void> abort, Sinks.One<Incident> done,
                                  AtomicReference<String> abortedBy, AtomicBoolean started) {
    }

    private record GateResult(EscalationReason reason, String detail) {
    }
}
