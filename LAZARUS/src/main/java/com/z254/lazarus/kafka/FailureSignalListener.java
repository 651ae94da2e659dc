package com.z254.lazarus.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.lazarus.api.dto.FailureSignalRequest;
import com.z254.lazarus.api.mapper.SignalMapper;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.trigger.FailureDispatcher;
import com.z254.lazarus.trigger.TriggerDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Kafka ingress for failure signals published by external monitors.
 * <p>
 * Each record is a JSON {@link FailureSignalRequest}. Records that do not parse, or that lack a
 * resource key or kind, are logged and skipped; the offset is acknowledged either way.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lazarus.kafka.enabled", havingValue = "true")
public class FailureSignalListener {

    static final String KAFKA_SOURCE = "kafka";
    private static final Duration DISPATCH_TIMEOUT = Duration.ofSeconds(30);

    private final FailureDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Counter consumedCounter;
    private final Counter rejectedCounter;

    public FailureSignalListener(FailureDispatcher dispatcher, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.consumedCounter = Counter.builder("lazarus.kafka.signals.consumed").register(meterRegistry);
        this.rejectedCounter = Counter.builder("lazarus.kafka.signals.rejected").register(meterRegistry);
    }

    @KafkaListener(
            topics = "${lazarus.kafka.topics.failure-signals:lazarus.failures.signals}",
            groupId = "${spring.kafka.consumer.group-id:lazarus-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consumedCounter.increment();
        try {
            Failure failure = parse(record.value());
            TriggerDecision decision = dispatcher.dispatch(failure).block(DISPATCH_TIMEOUT);
            log.info("Signal from partition {} offset {}: {} on {} -> {}",
                    record.partition(), record.offset(), failure.getKind(), failure.getResourceKey(),
                    decision == null ? "none" : decision.outcome());
        } catch (InvalidSignalException e) {
            rejectedCounter.increment();
            log.warn("Skipping signal at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getMessage());
        } finally {
            ack.acknowledge();
        }
    }

    // ========== Private Methods ==========

    Failure parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidSignalException("empty payload");
        }
        FailureSignalRequest request;
        try {
            request = objectMapper.readValue(payload, FailureSignalRequest.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSignalException("malformed JSON: " + e.getOriginalMessage());
        }
        if (isBlank(request.getResourceKey()) || isBlank(request.getKind())) {
            throw new InvalidSignalException("resourceKey and kind are required");
        }
        try {
            return SignalMapper.toFailure(request, KAFKA_SOURCE);
        } catch (IllegalArgumentException e) {
            throw new InvalidSignalException(e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static class InvalidSignalException extends RuntimeException {
        InvalidSignalException(String message) {
            super(message);
        }
    }
}
