package com.z254.lazarus.api.v1;

import com.z254.lazarus.observability.MetricAlert;
import com.z254.lazarus.observability.MetricsPublisher;
import com.z254.lazarus.playbook.PlaybookRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remediation success rates, MTTR percentiles and threshold alerts.
 */
@RestController
@RequestMapping("/api/v1/remediation-metrics")
@Tag(name = "Remediation Metrics", description = "Success rate and MTTR per playbook and fault kind")
public class RemediationMetricsController {

    private final MetricsPublisher metricsPublisher;
    private final PlaybookRegistry playbookRegistry;

    public RemediationMetricsController(MetricsPublisher metricsPublisher, PlaybookRegistry playbookRegistry) {
        this.metricsPublisher = metricsPublisher;
        this.playbookRegistry = playbookRegistry;
    }

    @GetMapping
    @Operation(summary = "Metrics overview", description = "Stats per playbook and per fault kind, unmatched failures per kind, plus registry summary")
    public Mono<ResponseEntity<Map<String, Object>>> overview() {
        return Mono.fromCallable(() -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("playbooks", metricsPublisher.playbookStats());
            body.put("kinds", metricsPublisher.kindStats());
            body.put("registry", playbookRegistry.summary());
            body.put("activeAlerts", metricsPublisher.activeAlerts().size());
            body.put("coverageGaps", metricsPublisher.coverageGaps());
            return ResponseEntity.ok(body);
        });
    }

    @GetMapping("/playbooks/{id}")
    @Operation(summary = "Playbook stats")
    public Mono<ResponseEntity<MetricsPublisher.ScopeSnapshot>> playbookStats(
            @Parameter(description = "Playbook ID") @PathVariable String id) {

        return Mono.justOrEmpty(metricsPublisher.playbookStats(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/kinds/{kind}")
    @Operation(summary = "Fault kind stats")
    public Mono<ResponseEntity<MetricsPublisher.ScopeSnapshot>> kindStats(
            @Parameter(description = "Fault kind") @PathVariable String kind) {

        return Mono.justOrEmpty(metricsPublisher.kindStats(kind))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/alerts")
    @Operation(summary = "List alerts", description = "Threshold alerts, newest first")
    public Mono<ResponseEntity<List<MetricAlert>>> alerts(
            @Parameter(description = "Only alerts not yet cleared")
            @RequestParam(defaultValue = "false") boolean active) {

        return Mono.fromCallable(() -> ResponseEntity.ok(
                active ? metricsPublisher.activeAlerts() : metricsPublisher.alerts()));
    }
}
