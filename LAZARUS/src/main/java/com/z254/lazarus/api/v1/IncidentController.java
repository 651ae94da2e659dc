package com.z254.lazarus.api.v1;

import com.z254.lazarus.api.dto.EscalationResolutionResponse;
import com.z254.lazarus.api.dto.IncidentDto;
import com.z254.lazarus.api.dto.IncidentListResponse;
import com.z254.lazarus.api.dto.IncidentSummaryDto;
import com.z254.lazarus.api.mapper.IncidentMapper;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.IncidentStatus;
import com.z254.lazarus.domain.service.IncidentService;
import com.z254.lazarus.orchestration.EscalationResolution;
import com.z254.lazarus.orchestration.IncidentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * REST API controller for incident querying and operator actions.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident querying, approval and abort")
public class IncidentController {

    private final IncidentService incidentService;
    private final IncidentOrchestrator orchestrator;

    public IncidentController(IncidentService incidentService, IncidentOrchestrator orchestrator) {
        this.incidentService = incidentService;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incident summaries, newest first")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status")
            @RequestParam(required = false) String status,
            @Parameter(description = "Only non-terminal incidents")
            @RequestParam(defaultValue = "false") boolean active) {

        return Mono.fromCallable(() -> {
            List<Incident> incidents = active ? incidentService.listActive()
                    : incidentService.list(status == null ? null : IncidentStatus.valueOf(status.toUpperCase(Locale.ROOT)));
            List<IncidentSummaryDto> summaries = incidents.stream()
                    .sorted(Comparator.comparing(Incident::getDetectedAt).reversed())
                    .map(IncidentMapper::toSummary)
                    .toList();
            return ResponseEntity.ok(IncidentListResponse.builder()
                    .incidents(summaries)
                    .total(summaries.size())
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Full incident record including executions and timeline")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.justOrEmpty(incidentService.get(id))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/timeline")
    @Operation(summary = "Get incident timeline", description = "Get timeline events for an incident")
    public Mono<ResponseEntity<List<Incident.TimelineEvent>>> getIncidentTimeline(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.justOrEmpty(incidentService.get(id))
                .map(incident -> ResponseEntity.ok(List.copyOf(incident.getTimeline())))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/history/{resourceKey}")
    @Operation(summary = "Resource history", description = "All incidents of a resource, oldest first")
    public Mono<ResponseEntity<List<IncidentSummaryDto>>> getHistory(
            @Parameter(description = "Resource key") @PathVariable String resourceKey) {

        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.history(resourceKey).stream()
                .map(IncidentMapper::toSummary)
                .toList()));
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve remediation",
               description = "Approve an incident escalated for approval; a follow-up incident runs the playbook")
    public Mono<ResponseEntity<EscalationResolutionResponse>> approve(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @RequestBody(required = false) ApproveRequest request) {

        String approver = request != null && request.getApprover() != null ? request.getApprover() : "operator";
        return Mono.fromCallable(() -> {
            EscalationResolution resolution = orchestrator.approve(id, approver);
            log.info("Incident {} approved by {}", id, approver);
            return ResponseEntity.ok(EscalationResolutionResponse.builder()
                    .ticket(resolution.ticket())
                    .followUp(resolution.followUp() == null ? null : IncidentMapper.toSummary(resolution.followUp()))
                    .build());
        });
    }

    @PostMapping("/{id}/abort")
    @Operation(summary = "Abort remediation",
               description = "Cancel the running attempt, roll back the current step and escalate the incident")
    public Mono<ResponseEntity<IncidentSummaryDto>> abort(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @RequestBody(required = false) AbortRequest request) {

        String actor = request != null && request.getActor() != null ? request.getActor() : "operator";
        log.warn("Abort of incident {} requested by {}", id, actor);
        return orchestrator.abort(id, actor)
                .map(IncidentMapper::toSummary)
                .map(ResponseEntity::ok);
    }

    // ========== Request DTOs ==========

    @Data
    public static class ApproveRequest {
        private String approver;
    }

    @Data
    public static class AbortRequest {
        private String actor;
    }
}
