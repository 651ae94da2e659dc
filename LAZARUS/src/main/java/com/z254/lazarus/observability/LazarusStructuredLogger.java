package com.z254.lazarus.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for LAZARUS.
 * <p>
 * Every event is logged as {@code message | data={json}} with the ids it concerns also put in the
 * MDC for the duration of the call, so the Logback pattern can show them.
 */
@Slf4j
@Component
public class LazarusStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_RESOURCE_KEY = "resourceKey";
    public static final String MDC_PLAYBOOK_ID = "playbookId";
    public static final String MDC_TICKET_ID = "ticketId";
    public static final String MDC_DETECTOR_ID = "detectorId";

    private static final ObjectMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, String resourceKey, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        Level level = switch (eventType) {
            case FAILED, ESCALATED -> Level.ERROR;
            case UNHANDLED, SUPPRESSED -> Level.WARN;
            case COALESCED -> Level.DEBUG;
            default -> Level.INFO;
        };
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put(MDC_INCIDENT_ID, incidentId);
        ids.put(MDC_RESOURCE_KEY, resourceKey);
        emit(level, eventType.name(), ids, message, details);
    }

    /**
     * Log a remediation attempt event.
     */
    public void logRemediationEvent(String incidentId, String playbookId, RemediationEventType eventType,
                                    String message, Map<String, Object> details) {
        Level level = switch (eventType) {
            case STEP_FAILED, ROLLBACK_FAILED, ATTEMPT_FAILED -> Level.ERROR;
            case ROLLED_BACK, RETRY_SCHEDULED, ABORTED -> Level.WARN;
            default -> Level.INFO;
        };
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put(MDC_INCIDENT_ID, incidentId);
        ids.put(MDC_PLAYBOOK_ID, playbookId);
        emit(level, eventType.name(), ids, message, details);
    }

    /**
     * Log an escalation event.
     */
    public void logEscalationEvent(String ticketId, String incidentId, EscalationEventType eventType,
                                   String message, Map<String, Object> details) {
        Level level = switch (eventType) {
            case CREATED, AUTOMATION_DISABLED, FALLBACK_ENABLED -> Level.WARN;
            default -> Level.INFO;
        };
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put(MDC_TICKET_ID, ticketId);
        ids.put(MDC_INCIDENT_ID, incidentId);
        emit(level, eventType.name(), ids, message, details);
    }

    public void logDetectorEvent(String detectorId, DetectorEventType eventType, String message,
                                 Map<String, Object> details) {
        Level level = switch (eventType) {
            case DISABLED -> Level.ERROR;
            case PROBE_FAILED -> Level.WARN;
            case FAILURE_DETECTED -> Level.INFO;
            default -> Level.DEBUG;
        };
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put(MDC_DETECTOR_ID, detectorId);
        emit(level, eventType.name(), ids, message, details);
    }

    /**
     * Put the non-null entries into the MDC until the returned scope is closed. Values that were
     * already set are restored on close.
     */
    public MdcScope withContext(Map<String, String> context) {
        Map<String, String> previous = new LinkedHashMap<>();
        context.forEach((key, value) -> {
            if (value != null) {
                previous.put(key, MDC.get(key));
                MDC.put(key, value);
            }
        });
        return new MdcScope(previous);
    }

    // ========== Private Methods ==========

    private void emit(Level level, String event, Map<String, String> ids, String message,
                      Map<String, Object> details) {
        if (!log.isEnabledForLevel(level)) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", event);
        data.putAll(ids);
        if (details != null) {
            data.putAll(details);
        }
        try (MdcScope scope = withContext(ids)) {
            log.atLevel(level).log("{} | data={}", message, toJson(data));
        }
    }

    private static String toJson(Map<String, Object> data) {
        try {
            return JSON.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            return data.toString();
        }
    }

    // ========== Event Type Enums ==========

    public enum IncidentEventType {
        OPENED, COALESCED, UNHANDLED, SUPPRESSED, TRANSITION, RESOLVED, ESCALATED, FAILED, APPROVED
    }

    public enum RemediationEventType {
        ATTEMPT_STARTED, STEP_SUCCEEDED, STEP_FAILED, ROLLED_BACK, ROLLBACK_FAILED,
        ATTEMPT_SUCCEEDED, ATTEMPT_FAILED, RETRY_SCHEDULED, ABORTED, DRY_RUN
    }

    public enum EscalationEventType {
        CREATED, FALLBACK_ENABLED, FALLBACK_DISABLED, AUTOMATION_DISABLED, AUTOMATION_ENABLED, RESOLVED
    }

    public enum DetectorEventType {
        REGISTERED, FAILURE_DETECTED, PROBE_FAILED, DISABLED, ENABLED, UNREGISTERED
    }

    /**
     * Restores the MDC entries replaced by {@link #withContext(Map)}.
     */
    public static final class MdcScope implements AutoCloseable {
        private final Map<String, String> previous;

        private MdcScope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
