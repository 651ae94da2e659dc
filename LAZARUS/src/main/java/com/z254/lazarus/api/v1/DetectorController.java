package com.z254.lazarus.api.v1;

import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.config.LazarusProperties;
import com.z254.lazarus.detection.Detector;
import com.z254.lazarus.detection.DetectorPool;
import com.z254.lazarus.detection.HeartbeatDetector;
import com.z254.lazarus.detection.LogPatternDetector;
import com.z254.lazarus.domain.model.Severity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API controller for the detector pool.
 * <p>
 * Heartbeat and log-pattern detectors can be registered at runtime; metric and health-endpoint
 * detectors come from configuration or from {@link Detector} beans.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/detectors")
@Tag(name = "Detectors", description = "Detector registration and status")
public class DetectorController {

    private static final int LOG_BUFFER = 100;

    private final DetectorPool detectorPool;
    private final LazarusProperties.Detection config;

    public DetectorController(DetectorPool detectorPool, LazarusProperties properties) {
        this.detectorPool = detectorPool;
        this.config = properties.getDetection();
    }

    @GetMapping
    @Operation(summary = "List detectors", description = "Status of every registered detector")
    public Mono<ResponseEntity<List<DetectorPool.DetectorStatus>>> listDetectors() {
        return Mono.fromCallable(() -> ResponseEntity.ok(detectorPool.list()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get detector status")
    public Mono<ResponseEntity<DetectorPool.DetectorStatus>> getDetector(
            @Parameter(description = "Detector ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(detectorPool.status(id)));
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable detector", description = "Re-enable a detector disabled after repeated probe errors")
    public Mono<ResponseEntity<DetectorPool.DetectorStatus>> enableDetector(
            @Parameter(description = "Detector ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(detectorPool.enable(id)));
    }

    @PostMapping("/heartbeat")
    @Operation(summary = "Register heartbeat detector")
    public Mono<ResponseEntity<DetectorPool.DetectorStatus>> registerHeartbeat(
            @Validated @RequestBody HeartbeatRegistration request) {

        return Mono.fromCallable(() -> {
            Duration timeout = request.getTimeoutMs() == null
                    ? config.getHeartbeatTimeout()
                    : Duration.ofMillis(request.getTimeoutMs());
            detectorPool.register(new HeartbeatDetector(request.getId(), request.getResourceKey(), timeout));
            log.info("Registered heartbeat detector {} for {}", request.getId(), request.getResourceKey());
            return ResponseEntity.status(HttpStatus.CREATED).body(detectorPool.status(request.getId()));
        });
    }

    @PostMapping("/log-pattern")
    @Operation(summary = "Register log-pattern detector")
    public Mono<ResponseEntity<DetectorPool.DetectorStatus>> registerLogPattern(
            @Validated @RequestBody LogPatternRegistration request) {

        return Mono.fromCallable(() -> {
            Severity severity = request.getSeverity() == null
                    ? Severity.MEDIUM
                    : Severity.valueOf(request.getSeverity().toUpperCase(Locale.ROOT));
            detectorPool.register(new LogPatternDetector(request.getId(), request.getResourceKey(),
                    request.getFaultKind(), request.getPattern(), severity,
                    config.getDefaultPollInterval(), LOG_BUFFER));
            log.info("Registered log-pattern detector {} for {}", request.getId(), request.getResourceKey());
            return ResponseEntity.status(HttpStatus.CREATED).body(detectorPool.status(request.getId()));
        });
    }

    @PostMapping("/{id}/lines")
    @Operation(summary = "Feed log lines", description = "Offer log lines to a log-pattern detector")
    public Mono<ResponseEntity<Map<String, Object>>> feedLines(
            @Parameter(description = "Detector ID") @PathVariable String id,
            @Validated @RequestBody LogLines request) {

        return Mono.fromCallable(() -> {
            Detector detector = detectorPool.get(id).orElseThrow(() -> new NotFoundException("Detector", id));
            if (!(detector instanceof LogPatternDetector logDetector)) {
                throw new IllegalArgumentException("Detector " + id + " does not take log lines");
            }
            long matched = request.getLines().stream().filter(logDetector::accept).count();
            return ResponseEntity.ok(Map.<String, Object>of(
                    "received", request.getLines().size(),
                    "matched", matched));
        });
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Unregister detector")
    public Mono<ResponseEntity<Void>> unregister(
            @Parameter(description = "Detector ID") @PathVariable String id) {

        return Mono.fromCallable(() -> {
            detectorPool.unregister(id);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    // ========== Request DTOs ==========

    @Data
    public static class HeartbeatRegistration {
        @NotBlank
        private String id;
        @NotBlank
        private String resourceKey;
        private Long timeoutMs;
    }

    @Data
    public static class LogPatternRegistration {
        @NotBlank
        private String id;
        @NotBlank
        private String resourceKey;
        @NotBlank
        private String faultKind;
        @NotBlank
        private String pattern;
        private String severity;
    }

    @Data
    public static class LogLines {
        @NotEmpty
        private List<String> lines;
    }
}
