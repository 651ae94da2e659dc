package com.z254.lazarus.detection;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Polls an HTTP health endpoint (Spring Boot actuator format).
 * <p>
 * Outcomes:
 * <ul>
 *     <li>2xx with status {@code UP} (or no status field): healthy</li>
 *     <li>Non-2xx, or another reported status: {@code health_check_failed}</li>
 *     <li>Connection error, timeout or open circuit: {@code service_unreachable}</li>
 * </ul>
 * Calls go through a resilience4j circuit breaker so that a dead endpoint is not hammered.
 */
@Slf4j
public class HealthEndpointDetector implements Detector {

    public static final String KIND = "health_endpoint";
    public static final String HEALTH_CHECK_FAILED = "health_check_failed";
    public static final String SERVICE_UNREACHABLE = "service_unreachable";

    private final String id;
    private final String resourceKey;
    private final String url;
    private final Duration pollInterval;
    private final Duration timeout;
    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public HealthEndpointDetector(String id, String resourceKey, String url, Duration pollInterval, Duration timeout,
                                  WebClient.Builder webClientBuilder, CircuitBreaker circuitBreaker) {
        this.id = id;
        this.resourceKey = resourceKey;
        this.url = url;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.webClient = webClientBuilder.build();
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public String targetResourceKey() {
        return resourceKey;
    }

    @Override
    public Optional<Failure> probe() {
        try {
            JsonNode body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .block(timeout.plusSeconds(1));
            String status = body == null || !body.hasNonNull("status") ? "UP" : body.get("status").asText();
            if ("UP".equalsIgnoreCase(status)) {
                return Optional.empty();
            }
            return Optional.of(failure(HEALTH_CHECK_FAILED, Severity.HIGH, Map.of("status", status)));
        } catch (WebClientResponseException e) {
            return Optional.of(failure(HEALTH_CHECK_FAILED, Severity.HIGH,
                    Map.of("httpStatus", String.valueOf(e.getStatusCode().value()))));
        } catch (WebClientRequestException | CallNotPermittedException e) {
            return Optional.of(failure(SERVICE_UNREACHABLE, Severity.CRITICAL, Map.of("error", describe(e))));
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                return Optional.of(failure(SERVICE_UNREACHABLE, Severity.CRITICAL, Map.of("error", "timed out")));
            }
            throw new DetectionException("Health probe of " + url + " failed", e);
        }
    }

    private Failure failure(String faultKind, Severity severity, Map<String, String> details) {
        log.debug("Health endpoint {} reports {} for {}", url, faultKind, resourceKey);
        Map<String, String> context = new HashMap<>(details);
        context.put("url", url);
        return Failure.builder()
                .detectorId(id)
                .resourceKey(resourceKey)
                .kind(faultKind)
                .severity(severity)
                .context(Map.copyOf(context))
                .build();
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
