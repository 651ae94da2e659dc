package com.z254.lazarus.action;

import com.z254.lazarus.config.LazarusProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Control plane reached over HTTP.
 * <p>
 * Resources are read with {@code GET /api/v1/resources/{key}} and updated with
 * {@code PATCH /api/v1/resources/{key}}. Calls are bounded by the configured read timeout and
 * protected by the {@code control-plane} circuit breaker.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lazarus.control-plane.mode", havingValue = "http")
public class HttpControlPlaneClient implements ControlPlane {

    private final WebClient webClient;
    private final LazarusProperties.ControlPlane config;

    public HttpControlPlaneClient(WebClient.Builder webClientBuilder, LazarusProperties properties) {
        this.config = properties.getControlPlane();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "control-plane", fallbackMethod = "snapshotFallback")
    @Retry(name = "control-plane")
    public Mono<ResourceState> snapshot(String resourceKey) {
        return webClient.get()
                .uri("/api/v1/resources/{key}", resourceKey)
                .retrieve()
                .bodyToMono(ResourceState.class)
                .timeout(config.getReadTimeout())
                .doOnError(error -> log.warn("Control plane snapshot failed: resource={}, error={}",
                        resourceKey, error.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "control-plane", fallbackMethod = "applyFallback")
    public Mono<ResourceState> apply(String resourceKey, Map<String, String> changes) {
        log.info("Applying {} to {} via control plane", changes, resourceKey);
        return webClient.patch()
                .uri("/api/v1/resources/{key}", resourceKey)
                .bodyValue(Map.of("attributes", changes))
                .retrieve()
                .bodyToMono(ResourceState.class)
                .timeout(config.getReadTimeout())
                .doOnError(error -> log.error("Control plane update failed: resource={}, error={}",
                        resourceKey, error.getMessage()));
    }

    /**
     * Fallback when the control plane is unavailable for reads.
     */
    public Mono<ResourceState> snapshotFallback(String resourceKey, Throwable throwable) {
        return Mono.error(new ControlPlaneException("Control plane unavailable reading "
                + resourceKey + ": " + throwable.getMessage(), throwable));
    }

    /**
     * Updates are never retried blindly; the executor decides about retries and rollback.
     */
    public Mono<ResourceState> applyFallback(String resourceKey, Map<String, String> changes, Throwable throwable) {
        return Mono.error(new ControlPlaneException("Control plane unavailable updating "
                + resourceKey + ": " + throwable.getMessage(), throwable));
    }
}
