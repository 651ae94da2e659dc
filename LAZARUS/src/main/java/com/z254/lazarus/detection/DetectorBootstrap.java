package com.z254.lazarus.detection;

import com.z254.lazarus.config.LazarusProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Registers the detectors declared under {@code lazarus.detection} and every {@link Detector} bean.
 */
@Slf4j
@Component
public class DetectorBootstrap {

    private final DetectorPool detectorPool;
    private final LazarusProperties.Detection config;
    private final WebClient.Builder webClientBuilder;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ObjectProvider<Detector> detectorBeans;

    public DetectorBootstrap(DetectorPool detectorPool,
                             LazarusProperties properties,
                             WebClient.Builder webClientBuilder,
                             CircuitBreakerRegistry circuitBreakerRegistry,
                             ObjectProvider<Detector> detectorBeans) {
        this.detectorPool = detectorPool;
        this.config = properties.getDetection();
        this.webClientBuilder = webClientBuilder;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.detectorBeans = detectorBeans;
    }

    @PostConstruct
    public void registerConfigured() {
        for (LazarusProperties.HeartbeatDetectorSpec heartbeat : config.getHeartbeats()) {
            Duration timeout = heartbeat.getTimeout() != null ? heartbeat.getTimeout() : config.getHeartbeatTimeout();
            detectorPool.register(new HeartbeatDetector(heartbeat.getId(), heartbeat.getResourceKey(), timeout));
        }
        for (LazarusProperties.HealthEndpointSpec endpoint : config.getHealthEndpoints()) {
            detectorPool.register(new HealthEndpointDetector(endpoint.getId(), endpoint.getResourceKey(),
                    endpoint.getUrl(), endpoint.getPollInterval(), endpoint.getTimeout(), webClientBuilder.clone(),
                    circuitBreakerRegistry.circuitBreaker("detector-" + endpoint.getId())));
        }
        detectorBeans.orderedStream().forEach(detectorPool::register);
        log.info("Registered {} detectors", detectorPool.list().size());
    }
}
