package com.z254.lazarus.detection;

import com.z254.lazarus.audit.AuditEntry;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.audit.InMemoryAuditLedgerStore;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.trigger.FailureDispatcher;
import com.z254.lazarus.trigger.TriggerDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectorPoolTest {

    private FailureDispatcher dispatcher;
    private RemediationMetrics metrics;
    private AuditLedger auditLedger;
    private DetectorPool pool;

    @BeforeEach
    void setUp() {
        dispatcher = mock(FailureDispatcher.class);
        metrics = mock(RemediationMetrics.class);
        when(dispatcher.dispatch(any())).thenReturn(Mono.just(TriggerDecision.unhandled("test")));
        auditLedger = new AuditLedger(new InMemoryAuditLedgerStore());
        LazarusProperties properties = new LazarusProperties();
        properties.getDetection().setMaxConsecutiveErrors(3);
        pool = new DetectorPool(dispatcher, auditLedger, metrics, new LazarusStructuredLogger(), properties);
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void observedFailureIsDispatched() {
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofHours(1));
        detector.failNext();
        pool.register(detector);

        pool.probeNow("probe-db");

        ArgumentCaptor<Failure> captor = ArgumentCaptor.forClass(Failure.class);
        verify(dispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().getResourceKey()).isEqualTo("db");
        assertThat(pool.status("probe-db").getFailuresDetected()).isEqualTo(1);
        assertThat(pool.status("probe-db").getLastProbeAt()).isNotNull();
    }

    @Test
    void healthyProbeDispatchesNothing() {
        pool.register(new ScriptedDetector("probe-db", Duration.ofHours(1)));

        pool.probeNow("probe-db");

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void repeatedProbeErrorsDisableDetector() {
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofHours(1));
        detector.errorAlways();
        pool.register(detector);

        for (int i = 0; i < 5; i++) {
            pool.probeNow("probe-db");
        }

        DetectorPool.DetectorStatus status = pool.status("probe-db");
        assertThat(status.isEnabled()).isFalse();
        assertThat(status.getConsecutiveErrors()).isEqualTo(3);
        assertThat(status.getLastError()).isEqualTo("probe exploded");
        assertThat(detector.probes.get()).isEqualTo(3);
        assertThat(auditLedger.entries()).extracting(AuditEntry::action).contains("detector_disabled");
        verify(metrics).recordDetectorDisabled("probe-db");
    }

    @Test
    void successfulProbeResetsErrorCount() {
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofHours(1));
        pool.register(detector);

        detector.errorNext();
        pool.probeNow("probe-db");
        detector.errorNext();
        pool.probeNow("probe-db");
        pool.probeNow("probe-db");

        assertThat(pool.status("probe-db").getConsecutiveErrors()).isZero();
        assertThat(pool.status("probe-db").isEnabled()).isTrue();
    }

    @Test
    void enableRestoresDisabledDetector() {
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofHours(1));
        detector.errorAlways();
        pool.register(detector);
        for (int i = 0; i < 3; i++) {
            pool.probeNow("probe-db");
        }

        DetectorPool.DetectorStatus status = pool.enable("probe-db");

        assertThat(status.isEnabled()).isTrue();
        assertThat(status.getConsecutiveErrors()).isZero();
        assertThat(status.getLastError()).isNull();
        assertThat(auditLedger.entries()).extracting(AuditEntry::action).contains("detector_enabled");
    }

    @Test
    void startedPoolPollsOnSchedule() {
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofMillis(20));
        pool.register(detector);

        pool.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> detector.probes.get() >= 3);
    }

    @Test
    void detectorRegisteredAfterStartPollsImmediately() {
        pool.start();
        ScriptedDetector detector = new ScriptedDetector("probe-db", Duration.ofMillis(20));

        pool.register(detector);

        await().atMost(Duration.ofSeconds(5)).until(() -> detector.probes.get() >= 1);
    }

    @Test
    void duplicateIdIsRejected() {
        pool.register(new ScriptedDetector("probe-db", Duration.ofHours(1)));

        assertThatThrownBy(() -> pool.register(new ScriptedDetector("probe-db", Duration.ofHours(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void heartbeatOnlyForHeartbeatDetectors() {
        pool.register(new ScriptedDetector("probe-db", Duration.ofHours(1)));
        pool.register(new HeartbeatDetector("hb-db", "db", Duration.ofSeconds(30)));

        assertThat(pool.heartbeat("hb-db").getLastBeat()).isNotNull();
        assertThatThrownBy(() -> pool.heartbeat("probe-db")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pool.heartbeat("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unregisterRemovesDetector() {
        pool.register(new ScriptedDetector("probe-db", Duration.ofHours(1)));

        pool.unregister("probe-db");

        assertThat(pool.get("probe-db")).isEmpty();
        assertThat(pool.list()).isEmpty();
        assertThatThrownBy(() -> pool.unregister("probe-db")).isInstanceOf(NotFoundException.class);
    }

    /**
     * Detector whose next outcomes are set by the test.
     */
    static class ScriptedDetector implements Detector {
        private final String id;
        private final Duration pollInterval;
        private final Deque<String> script = new ArrayDeque<>();
        private volatile boolean errorAlways;
        final AtomicInteger probes = new AtomicInteger();

        ScriptedDetector(String id, Duration pollInterval) {
            this.id = id;
            this.pollInterval = pollInterval;
        }

        void failNext() {
            script.addLast("fail");
        }

        void errorNext() {
            script.addLast("error");
        }

        void errorAlways() {
            errorAlways = true;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String kind() {
            return "scripted";
        }

        @Override
        public Duration pollInterval() {
            return pollInterval;
        }

        @Override
        public String targetResourceKey() {
            return "db";
        }

        @Override
        public synchronized Optional<Failure> probe() {
            probes.incrementAndGet();
            String next = script.pollFirst();
            if (errorAlways || "error".equals(next)) {
                throw new DetectionException("probe exploded");
            }
            if ("fail".equals(next)) {
                return Optional.of(Failure.builder().detectorId(id).resourceKey("db").kind("probe_failed").build());
            }
            return Optional.empty();
        }
    }
}
