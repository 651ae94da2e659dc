package com.z254.lazarus.action;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sandbox control plane holding simulated resources in memory.
 * <p>
 * Supports chaos injection for exercising playbooks end to end:
 * <ul>
 *     <li>Fault injection - overwrite resource attributes</li>
 *     <li>Pinning - an attribute ignores updates, so verification fails</li>
 *     <li>Update failures - the next N updates are rejected</li>
 *     <li>Latency - updates are delayed, so steps time out</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lazarus.control-plane.mode", havingValue = "sandbox", matchIfMissing = true)
public class InMemoryControlPlane implements ControlPlane {

    private final Map<String, Map<String, String>> resources = new ConcurrentHashMap<>();
    private final Map<String, Chaos> chaos = new ConcurrentHashMap<>();

    @Override
    public Mono<ResourceState> snapshot(String resourceKey) {
        return Mono.fromCallable(() -> read(resourceKey));
    }

    @Override
    public Mono<ResourceState> apply(String resourceKey, Map<String, String> changes) {
        Chaos c = chaos.get(resourceKey);
        Duration delay = c == null || c.getDelay() == null ? Duration.ZERO : c.getDelay();
        Mono<ResourceState> update = Mono.fromCallable(() -> update(resourceKey, changes));
        return delay.isZero() ? update : update.delaySubscription(delay);
    }

    /**
     * Overwrite attributes of a resource, creating it if needed.
     */
    public ResourceState inject(String resourceKey, Map<String, String> attributes) {
        resources.computeIfAbsent(resourceKey, k -> new ConcurrentHashMap<>()).putAll(attributes);
        log.info("SANDBOX: injected {} into {}", attributes, resourceKey);
        return read(resourceKey);
    }

    /**
     * Keep an attribute at the given value regardless of later updates.
     */
    public void pin(String resourceKey, String attribute, String value) {
        inject(resourceKey, Map.of(attribute, value));
        chaos(resourceKey).getPinned().put(attribute, value);
    }

    public void failNextUpdates(String resourceKey, int count) {
        chaos(resourceKey).getFailNext().set(count);
    }

    public void delayUpdates(String resourceKey, Duration delay) {
        chaos(resourceKey).setDelay(delay);
    }

    public void clearChaos(String resourceKey) {
        chaos.remove(resourceKey);
    }

    public void reset() {
        resources.clear();
        chaos.clear();
    }

    public Map<String, ResourceState> list() {
        Map<String, ResourceState> states = new TreeMap<>();
        resources.keySet().forEach(key -> states.put(key, read(key)));
        return states;
    }

    public ChaosState chaosState(String resourceKey) {
        Chaos c = chaos.get(resourceKey);
        if (c == null) {
            return ChaosState.builder().pinned(Map.of()).build();
        }
        return ChaosState.builder()
                .pinned(Map.copyOf(c.getPinned()))
                .failNextUpdates(c.getFailNext().get())
                .delayMs(c.getDelay() == null ? 0 : c.getDelay().toMillis())
                .build();
    }

    // ========== Private Methods ==========

    private ResourceState read(String resourceKey) {
        Map<String, String> attributes = resources.getOrDefault(resourceKey, Map.of());
        return ResourceState.builder()
                .resourceKey(resourceKey)
                .attributes(new HashMap<>(attributes))
                .observedAt(Instant.now())
                .build();
    }

    private ResourceState update(String resourceKey, Map<String, String> changes) {
        Chaos c = chaos.get(resourceKey);
        if (c != null && c.getFailNext().getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new ControlPlaneException("SANDBOX: update of " + resourceKey + " rejected");
        }
        Map<String, String> attributes = resources.computeIfAbsent(resourceKey, k -> new ConcurrentHashMap<>());
        changes.forEach((name, value) -> {
            if (c != null && c.getPinned().containsKey(name)) {
                return;
            }
            // an empty value removes the attribute
            if (value == null || value.isEmpty()) {
                attributes.remove(name);
            } else {
                attributes.put(name, value);
            }
        });
        return read(resourceKey);
    }

    private Chaos chaos(String resourceKey) {
        return chaos.computeIfAbsent(resourceKey, k -> new Chaos());
    }

    // ========== Data Classes ==========

    @Data
    private static class Chaos {
        private final Map<String, String> pinned = new ConcurrentHashMap<>();
        private final AtomicInteger failNext = new AtomicInteger();
        private volatile Duration delay;
    }

    @Data
    @Builder
    public static class ChaosState {
        private Map<String, String> pinned;
        private int failNextUpdates;
        private long delayMs;
    }
}
