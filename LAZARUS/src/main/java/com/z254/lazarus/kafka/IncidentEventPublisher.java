package com.z254.lazarus.kafka;

import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.service.IncidentEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes incident lifecycle events, keyed by resource so events of one resource stay ordered.
 */
@Slf4j
@Component
public class IncidentEventPublisher implements IncidentEventListener {

    private final ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate;
    private final LazarusProperties.Kafka config;

    public IncidentEventPublisher(ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate,
                                  LazarusProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.config = properties.getKafka();
    }

    @Override
    public void onIncidentEvent(Incident incident, String eventType) {
        KafkaTemplate<String, Object> template = config.isEnabled() ? kafkaTemplate.getIfAvailable() : null;
        if (template == null) {
            log.debug("Incident event {} for {} not published (Kafka disabled)", eventType, incident.getId());
            return;
        }
        String topic = config.getTopics().getIncidentEvents();
        template.send(topic, incident.getResourceKey(), toEvent(incident, eventType))
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish incident event: incidentId={}, type={}, error={}",
                                incident.getId(), eventType, ex.getMessage());
                    } else {
                        log.debug("Published incident event: incidentId={}, type={}, partition={}",
                                incident.getId(), eventType, result.getRecordMetadata().partition());
                    }
                });
    }

    static Map<String, Object> toEvent(Incident incident, String eventType) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("schemaVersion", "1.0.0");
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("incidentId", incident.getId());
        event.put("resourceKey", incident.getResourceKey());
        event.put("kind", incident.getKind());
        event.put("severity", String.valueOf(incident.getSeverity()));
        event.put("status", String.valueOf(incident.getStatus()));
        event.put("playbookId", incident.getPlaybookId());
        event.put("playbookVersion", incident.getPlaybookVersion());
        event.put("attemptCount", incident.getAttemptCount());
        event.put("mttrSeconds", incident.getMttrSeconds());
        event.put("parentIncidentId", incident.getParentIncidentId());
        event.put("escalationTicketId", incident.getEscalationTicketId());
        return event;
    }
}
