package com.z254.lazarus.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;
import com.z254.lazarus.trigger.FailureDispatcher;
import com.z254.lazarus.trigger.TriggerDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FailureSignalListenerTest {

    @Mock
    private FailureDispatcher dispatcher;

    @Mock
    private Acknowledgment ack;

    private SimpleMeterRegistry meterRegistry;
    private FailureSignalListener listener;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        listener = new FailureSignalListener(dispatcher, new ObjectMapper().registerModule(new JavaTimeModule()),
                meterRegistry);
    }

    @Test
    void validSignalIsDispatchedAndAcknowledged() {
        when(dispatcher.dispatch(any())).thenReturn(Mono.just(TriggerDecision.unhandled("test")));

        listener.consume(record("""
                {"resourceKey": "db", "kind": "heartbeat_timeout", "severity": "critical",
                 "detectedAt": "2026-03-01T12:00:00Z", "context": {"region": "eu"}}
                """), ack);

        ArgumentCaptor<Failure> captor = ArgumentCaptor.forClass(Failure.class);
        verify(dispatcher).dispatch(captor.capture());
        Failure failure = captor.getValue();
        assertThat(failure.getResourceKey()).isEqualTo("db");
        assertThat(failure.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(failure.getDetectorId()).isEqualTo(FailureSignalListener.KAFKA_SOURCE);
        assertThat(failure.getDetectedAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(failure.getContext()).containsEntry("region", "eu");
        verify(ack).acknowledge();
        assertThat(meterRegistry.counter("lazarus.kafka.signals.consumed").count()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "{not json",
            "{\"kind\": \"heartbeat_timeout\"}",
            "{\"resourceKey\": \"db\", \"kind\": \"heartbeat_timeout\", \"severity\": \"apocalyptic\"}"
    })
    void invalidSignalIsSkippedButAcknowledged(String payload) {
        listener.consume(record(payload), ack);

        verify(dispatcher, never()).dispatch(any());
        verify(ack).acknowledge();
        assertThat(meterRegistry.counter("lazarus.kafka.signals.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void dispatchErrorStillAcknowledges() {
        when(dispatcher.dispatch(any())).thenReturn(Mono.error(new IllegalStateException("engine down")));

        assertThatThrownBy(() -> listener.consume(record("{\"resourceKey\": \"db\", \"kind\": \"x\"}"), ack))
                .hasMessageContaining("engine down");
        verify(ack).acknowledge();
    }

    @Test
    void signalWithoutDetectorUsesKafkaSource() {
        Failure failure = listener.parse("{\"resourceKey\": \"db\", \"kind\": \"x\", \"detectorId\": \"prom\"}");

        assertThat(failure.getDetectorId()).isEqualTo("prom");
        assertThat(failure.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("lazarus.failures.signals", 0, 42L, "db", value);
    }
}
