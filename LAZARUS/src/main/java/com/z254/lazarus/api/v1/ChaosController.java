package com.z254.lazarus.api.v1;

import com.z254.lazarus.action.InMemoryControlPlane;
import com.z254.lazarus.action.ResourceState;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Chaos endpoints over the sandbox control plane.
 * <p>
 * These endpoints seed simulated resources and inject faults so playbooks can be exercised end to
 * end without a real control plane. Only present in sandbox mode.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chaos/resources")
@ConditionalOnProperty(name = "lazarus.control-plane.mode", havingValue = "sandbox", matchIfMissing = true)
public class ChaosController {

    private final InMemoryControlPlane controlPlane;

    public ChaosController(InMemoryControlPlane controlPlane) {
        this.controlPlane = controlPlane;
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, ResourceState>>> listResources() {
        return Mono.fromCallable(() -> ResponseEntity.ok(controlPlane.list()));
    }

    @GetMapping("/{resourceKey}")
    public Mono<ResponseEntity<ChaosResponse>> getResource(@PathVariable String resourceKey) {
        return controlPlane.snapshot(resourceKey)
                .map(state -> ResponseEntity.ok(response(resourceKey, "STATE", state)));
    }

    /**
     * Overwrite attributes, e.g. {@code {"attributes": {"status": "down"}}}.
     */
    @PostMapping("/{resourceKey}/inject")
    public Mono<ResponseEntity<ChaosResponse>> inject(
            @PathVariable String resourceKey,
            @Validated @RequestBody InjectRequest request) {

        return Mono.fromCallable(() -> {
            ResourceState state = controlPlane.inject(resourceKey, request.getAttributes());
            log.warn("CHAOS: fault injected into {}: {}", resourceKey, request.getAttributes());
            return ResponseEntity.ok(response(resourceKey, "FAULT_INJECTED", state));
        });
    }

    /**
     * Pin an attribute so updates no longer take effect and verification fails.
     */
    @PostMapping("/{resourceKey}/pin")
    public Mono<ResponseEntity<ChaosResponse>> pin(
            @PathVariable String resourceKey,
            @Validated @RequestBody PinRequest request) {

        return Mono.fromCallable(() -> {
            controlPlane.pin(resourceKey, request.getAttribute(), request.getValue());
            log.warn("CHAOS: {}.{} pinned to {}", resourceKey, request.getAttribute(), request.getValue());
            return ResponseEntity.ok(response(resourceKey, "ATTRIBUTE_PINNED", null));
        });
    }

    @PostMapping("/{resourceKey}/fail-updates")
    public Mono<ResponseEntity<ChaosResponse>> failUpdates(
            @PathVariable String resourceKey,
            @Validated @RequestBody FailUpdatesRequest request) {

        return Mono.fromCallable(() -> {
            controlPlane.failNextUpdates(resourceKey, request.getCount());
            log.warn("CHAOS: next {} updates of {} will fail", request.getCount(), resourceKey);
            return ResponseEntity.ok(response(resourceKey, "UPDATE_FAILURE", null));
        });
    }

    @PostMapping("/{resourceKey}/delay-updates")
    public Mono<ResponseEntity<ChaosResponse>> delayUpdates(
            @PathVariable String resourceKey,
            @Validated @RequestBody DelayRequest request) {

        return Mono.fromCallable(() -> {
            controlPlane.delayUpdates(resourceKey, Duration.ofMillis(request.getDelayMs()));
            log.warn("CHAOS: updates of {} delayed by {}ms", resourceKey, request.getDelayMs());
            return ResponseEntity.ok(response(resourceKey, "UPDATE_DELAY", null));
        });
    }

    @DeleteMapping("/{resourceKey}/chaos")
    public Mono<ResponseEntity<ChaosResponse>> clearChaos(@PathVariable String resourceKey) {
        return Mono.fromCallable(() -> {
            controlPlane.clearChaos(resourceKey);
            log.info("CHAOS: cleared for {}", resourceKey);
            return ResponseEntity.ok(response(resourceKey, "CLEARED", null));
        });
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> reset() {
        return Mono.fromCallable(() -> {
            controlPlane.reset();
            log.info("CHAOS: sandbox reset");
            return ResponseEntity.noContent().<Void>build();
        });
    }

    // ========== Private Methods ==========

    private ChaosResponse response(String resourceKey, String chaosType, ResourceState state) {
        return ChaosResponse.builder()
                .resourceKey(resourceKey)
                .chaosType(chaosType)
                .state(state)
                .chaos(controlPlane.chaosState(resourceKey))
                .at(Instant.now())
                .build();
    }

    // ========== Request/Response DTOs ==========

    @Data
    public static class InjectRequest {
        @NotEmpty
        private Map<String, String> attributes;
    }

    @Data
    public static class PinRequest {
        @NotBlank
        private String attribute;
        @NotBlank
        private String value;
    }

    @Data
    public static class FailUpdatesRequest {
        @Positive
        private int count = 1;
    }

    @Data
    public static class DelayRequest {
        @Positive
        private long delayMs;
    }

    @Data
    @Builder
    public static class ChaosResponse {
        private String resourceKey;
        private String chaosType;
        private ResourceState state;
        private InMemoryControlPlane.ChaosState chaos;
        private Instant at;
    }
}
