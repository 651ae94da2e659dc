package com.z254.lazarus.escalation;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Degraded-mode switches per resource, turned on by escalations and off when their ticket is resolved.
 */
@Slf4j
@Component
public class FallbackModeRegistry {

    private final Map<String, FallbackMode> modes = new ConcurrentHashMap<>();

    public FallbackMode enable(String resourceKey, String capability, String ticketId) {
        FallbackMode mode = FallbackMode.builder()
                .resourceKey(resourceKey)
                .capability(capability)
                .ticketId(ticketId)
                .enabledAt(Instant.now())
                .build();
        modes.put(resourceKey, mode);
        log.warn("Fallback mode {} enabled for {} (ticket {})", capability, resourceKey, ticketId);
        return mode;
    }

    /**
     * Disable the fallback of a resource if it was enabled by the given ticket.
     */
    public boolean disable(String resourceKey, String ticketId) {
        FallbackMode mode = modes.get(resourceKey);
        if (mode == null || !mode.getTicketId().equals(ticketId) || !modes.remove(resourceKey, mode)) {
            return false;
        }
        log.info("Fallback mode disabled for {} (ticket {})", resourceKey, ticketId);
        return true;
    }

    public Optional<FallbackMode> get(String resourceKey) {
        return Optional.ofNullable(modes.get(resourceKey));
    }

    public boolean isEnabled(String resourceKey) {
        return modes.containsKey(resourceKey);
    }

    public List<FallbackMode> list() {
        return List.copyOf(modes.values());
    }

    @Data
    @Builder
    public static class FallbackMode {
        private String resourceKey;
        private String capability;
        private String ticketId;
        private Instant enabledAt;
    }
}
