package com.z254.lazarus.escalation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resources whose automated remediation is disabled until an operator clears the blocking ticket.
 */
@Slf4j
@Component
public class AutomationGuard {

    private final Map<String, String> disabled = new ConcurrentHashMap<>();

    public void disable(String resourceKey, String ticketId) {
        disabled.put(resourceKey, ticketId);
        log.error("Automation disabled for {} until ticket {} is resolved", resourceKey, ticketId);
    }

    /**
     * Re-enable automation if it was disabled by the given ticket.
     */
    public boolean enable(String resourceKey, String ticketId) {
        boolean enabled = disabled.remove(resourceKey, ticketId);
        if (enabled) {
            log.info("Automation re-enabled for {}", resourceKey);
        }
        return enabled;
    }

    public boolean isDisabled(String resourceKey) {
        return disabled.containsKey(resourceKey);
    }

    public Optional<String> blockingTicket(String resourceKey) {
        return Optional.ofNullable(disabled.get(resourceKey));
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(disabled);
    }
}
