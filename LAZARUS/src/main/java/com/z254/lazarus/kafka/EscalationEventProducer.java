package com.z254.lazarus.kafka;

import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.escalation.EscalationListener;
import com.z254.lazarus.escalation.EscalationTicket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kafka producer for escalation tickets, consumed by paging and ticketing integrations.
 */
@Slf4j
@Component
public class EscalationEventProducer implements EscalationListener {

    private final ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate;
    private final LazarusProperties.Kafka config;

    public EscalationEventProducer(ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate,
                                   LazarusProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.config = properties.getKafka();
    }

    @Override
    public void onTicketEvent(EscalationTicket ticket, String eventType) {
        KafkaTemplate<String, Object> template = config.isEnabled() ? kafkaTemplate.getIfAvailable() : null;
        if (template == null) {
            log.info("Escalation {} {} for incident {} ({}), Kafka disabled",
                    ticket.getId(), eventType, ticket.getIncidentId(), ticket.getReason());
            return;
        }
        String topic = config.getTopics().getEscalations();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("schemaVersion", "1.0.0");
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("ticket", ticket);

        template.send(topic, ticket.getResourceKey(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to emit escalation event: ticketId={}, error={}",
                                ticket.getId(), ex.getMessage());
                    } else {
                        log.info("Emitted escalation event: ticketId={}, topic={}, partition={}",
                                ticket.getId(), topic, result.getRecordMetadata().partition());
                    }
                });
    }
}
