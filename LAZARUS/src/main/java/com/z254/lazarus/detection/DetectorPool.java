package com.z254.lazarus.detection;

import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.LazarusStructuredLogger.DetectorEventType;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.trigger.FailureDispatcher;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs registered detectors and forwards what they observe to the {@link FailureDispatcher}.
 * <p>
 * Each enabled detector polls on its own {@code Flux.interval} subscription on the detection
 * scheduler, so a slow probe only delays its own detector. A detector whose probe fails
 * {@code lazarus.detection.max-consecutive-errors} times in a row is disabled until
 * {@link #enable(String)} is called.
 */
@Slf4j
@Component
public class DetectorPool {

    private final FailureDispatcher dispatcher;
    private final AuditLedger auditLedger;
    private final RemediationMetrics metrics;
    private final LazarusStructuredLogger structuredLogger;
    private final int maxConsecutiveErrors;

    private final Scheduler scheduler = Schedulers.newBoundedElastic(
            Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "lazarus-detection");
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private volatile boolean started;

    public DetectorPool(FailureDispatcher dispatcher,
                        AuditLedger auditLedger,
                        RemediationMetrics metrics,
                        LazarusStructuredLogger structuredLogger,
                        LazarusProperties properties) {
        this.dispatcher = dispatcher;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.maxConsecutiveErrors = properties.getDetection().getMaxConsecutiveErrors();
    }

    /**
     * Add a detector; it starts polling right away if the pool is running.
     *
     * @throws IllegalArgumentException if a detector with the same id is registered
     */
    public void register(Detector detector) {
        Registration registration = new Registration(detector);
        if (registrations.putIfAbsent(detector.id(), registration) != null) {
            throw new IllegalArgumentException("Detector " + detector.id() + " is already registered");
        }
        auditLedger.append("detector-pool", "detector_registered", Map.of(
                "detectorId", detector.id(),
                "kind", detector.kind(),
                "resourceKey", detector.targetResourceKey(),
                "pollIntervalMs", detector.pollInterval().toMillis()));
        structuredLogger.logDetectorEvent(detector.id(), DetectorEventType.REGISTERED, "Detector registered",
                Map.of("resourceKey", detector.targetResourceKey(), "kind", detector.kind()));
        if (started) {
            schedule(registration);
        }
    }

    public void unregister(String detectorId) {
        Registration registration = registrations.remove(detectorId);
        if (registration == null) {
            throw new NotFoundException("Detector", detectorId);
        }
        registration.cancel();
        auditLedger.append("detector-pool", "detector_unregistered", Map.of("detectorId", detectorId));
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.UNREGISTERED, "Detector unregistered", null);
    }

    /**
     * Re-enable a detector disabled after repeated probe errors. Enabling an enabled detector is a no-op.
     */
    public DetectorStatus enable(String detectorId) {
        Registration registration = require(detectorId);
        synchronized (registration) {
            if (!registration.enabled) {
                registration.enabled = true;
                registration.consecutiveErrors.set(0);
                registration.lastError = null;
                auditLedger.append("operator", "detector_enabled", Map.of("detectorId", detectorId));
                structuredLogger.logDetectorEvent(detectorId, DetectorEventType.ENABLED, "Detector re-enabled", null);
                if (started) {
                    schedule(registration);
                }
            }
        }
        return registration.status();
    }

    /**
     * Record a heartbeat for a {@link HeartbeatDetector}.
     *
     * @throws IllegalArgumentException if the detector does not take heartbeats
     */
    public HeartbeatDetector heartbeat(String detectorId) {
        Detector detector = require(detectorId).detector;
        if (!(detector instanceof HeartbeatDetector heartbeat)) {
            throw new IllegalArgumentException("Detector " + detectorId + " does not take heartbeats");
        }
        heartbeat.beat();
        return heartbeat;
    }

    public List<DetectorStatus> list() {
        return registrations.values().stream()
                .map(Registration::status)
                .sorted(Comparator.comparing(DetectorStatus::getId))
                .toList();
    }

    public Optional<Detector> get(String detectorId) {
        return Optional.ofNullable(registrations.get(detectorId)).map(r -> r.detector);
    }

    public DetectorStatus status(String detectorId) {
        return require(detectorId).status();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (started) {
            return;
        }
        started = true;
        registrations.values().forEach(this::schedule);
        log.info("Detector pool started with {} detectors", registrations.size());
    }

    @PreDestroy
    public void stop() {
        started = false;
        registrations.values().forEach(Registration::cancel);
        scheduler.dispose();
    }

    /**
     * Run one probe of a detector immediately, outside its polling schedule.
     */
    void probeNow(String detectorId) {
        runProbe(require(detectorId));
    }

    // ========== Private Methods ==========

    private Registration require(String detectorId) {
        Registration registration = registrations.get(detectorId);
        if (registration == null) {
            throw new NotFoundException("Detector", detectorId);
        }
        return registration;
    }

    private void schedule(Registration registration) {
        synchronized (registration) {
            if (!registration.enabled || registration.subscription != null) {
                return;
            }
            Duration interval = registration.detector.pollInterval();
            registration.subscription = Flux.interval(interval, interval, scheduler)
                    .onBackpressureDrop()
                    .subscribe(tick -> runProbe(registration),
                            error -> log.error("Polling of {} stopped", registration.detector.id(), error));
        }
    }

    private void runProbe(Registration registration) {
        Detector detector = registration.detector;
        if (!registration.enabled) {
            return;
        }
        registration.lastProbeAt = Instant.now();
        Optional<Failure> failure;
        try {
            failure = detector.probe();
        } catch (RuntimeException e) {
            onProbeError(registration, e);
            return;
        }
        registration.consecutiveErrors.set(0);
        failure.ifPresent(f -> submit(registration, f));
    }

    private void submit(Registration registration, Failure failure) {
        registration.failuresDetected.incrementAndGet();
        structuredLogger.logDetectorEvent(failure.getDetectorId(), DetectorEventType.FAILURE_DETECTED,
                "Failure detected", Map.of("resourceKey", failure.getResourceKey(), "kind", failure.getKind(),
                        "severity", failure.getSeverity().name()));
        dispatcher.dispatch(failure).subscribe(
                decision -> log.debug("Failure {} evaluated: {}", failure.getId(), decision.outcome()),
                error -> log.warn("Failure {} could not be evaluated: {}", failure.getId(), error.getMessage()));
    }

    private void onProbeError(Registration registration, RuntimeException error) {
        String detectorId = registration.detector.id();
        int errors = registration.consecutiveErrors.incrementAndGet();
        registration.lastError = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.PROBE_FAILED, "Probe failed",
                Map.of("consecutiveErrors", errors, "error", registration.lastError));
        if (errors >= maxConsecutiveErrors) {
            disable(registration);
        }
    }

    private void disable(Registration registration) {
        synchronized (registration) {
            if (!registration.enabled) {
                return;
            }
            registration.enabled = false;
            registration.cancel();
        }
        String detectorId = registration.detector.id();
        auditLedger.append("detector-pool", "detector_disabled", Map.of(
                "detectorId", detectorId,
                "resourceKey", registration.detector.targetResourceKey(),
                "consecutiveErrors", registration.consecutiveErrors.get(),
                "lastError", String.valueOf(registration.lastError)));
        metrics.recordDetectorDisabled(detectorId);
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.DISABLED,
                "Detector disabled after repeated probe errors",
                Map.of("consecutiveErrors", registration.consecutiveErrors.get()));
    }

    // ========== Data Classes ==========

    private static final class Registration {
        private final Detector detector;
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        private final AtomicLong failuresDetected = new AtomicLong();
        private volatile boolean enabled = true;
        private volatile Disposable subscription;
        private volatile Instant lastProbeAt;
        private volatile String lastError;

        Registration(Detector detector) {
            this.detector = detector;
        }

        synchronized void cancel() {
            if (subscription != null) {
                subscription.dispose();
                subscription = null;
            }
        }

        DetectorStatus status() {
            return DetectorStatus.builder()
                    .id(detector.id())
                    .kind(detector.kind())
                    .resourceKey(detector.targetResourceKey())
                    .pollInterval(detector.pollInterval())
                    .enabled(enabled)
                    .consecutiveErrors(consecutiveErrors.get())
                    .failuresDetected(failuresDetected.get())
                    .lastProbeAt(lastProbeAt)
                    .lastError(lastError)
                    .build();
        }
    }

    @Data
    @Builder
    public static class DetectorStatus {
        private String id;
        private String kind;
        private String resourceKey;
        private Duration pollInterval;
        private boolean enabled;
        private int consecutiveErrors;
        private long failuresDetected;
        private Instant lastProbeAt;
        private String lastError;
    }
}
