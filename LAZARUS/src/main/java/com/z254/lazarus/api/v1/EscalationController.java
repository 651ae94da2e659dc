package com.z254.lazarus.api.v1;

import com.z254.lazarus.api.dto.EscalationResolutionResponse;
import com.z254.lazarus.api.mapper.IncidentMapper;
import com.z254.lazarus.escalation.AutomationGuard;
import com.z254.lazarus.escalation.EscalationManager;
import com.z254.lazarus.escalation.EscalationTicket;
import com.z254.lazarus.escalation.FallbackModeRegistry;
import com.z254.lazarus.orchestration.EscalationResolution;
import com.z254.lazarus.orchestration.IncidentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API controller for escalation tickets and degraded fallback modes.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Escalations", description = "Operator tickets, fallback modes and automation blocks")
public class EscalationController {

    private final EscalationManager escalationManager;
    private final FallbackModeRegistry fallbackModes;
    private final AutomationGuard automationGuard;
    private final IncidentOrchestrator orchestrator;

    public EscalationController(EscalationManager escalationManager,
                                FallbackModeRegistry fallbackModes,
                                AutomationGuard automationGuard,
                                IncidentOrchestrator orchestrator) {
        this.escalationManager = escalationManager;
        this.fallbackModes = fallbackModes;
        this.automationGuard = automationGuard;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/escalations")
    @Operation(summary = "List tickets", description = "List escalation tickets, optionally by status")
    public Mono<ResponseEntity<List<EscalationTicket>>> listTickets(
            @Parameter(description = "OPEN or RESOLVED")
            @RequestParam(required = false) String status) {

        return Mono.fromCallable(() -> ResponseEntity.ok(escalationManager.list(status == null ? null
                : EscalationTicket.TicketStatus.valueOf(status.toUpperCase(Locale.ROOT)))));
    }

    @GetMapping("/escalations/{id}")
    @Operation(summary = "Get ticket")
    public Mono<ResponseEntity<EscalationTicket>> getTicket(
            @Parameter(description = "Ticket ID") @PathVariable String id) {

        return Mono.justOrEmpty(escalationManager.get(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/escalations/{id}/resolve")
    @Operation(summary = "Resolve ticket",
               description = "Close a ticket, restoring automation; RETRY_REMEDIATION also runs a follow-up incident")
    public Mono<ResponseEntity<EscalationResolutionResponse>> resolve(
            @Parameter(description = "Ticket ID") @PathVariable String id,
            @Validated @RequestBody ResolveRequest request) {

        return Mono.fromCallable(() -> {
            EscalationResolution resolution = orchestrator.resolveEscalation(
                    id, request.getResolvedBy(), request.getResolution());
            log.info("Escalation {} resolved by {} with {}", id, request.getResolvedBy(), request.getResolution());
            return ResponseEntity.ok(EscalationResolutionResponse.builder()
                    .ticket(resolution.ticket())
                    .followUp(resolution.followUp() == null ? null : IncidentMapper.toSummary(resolution.followUp()))
                    .build());
        });
    }

    @GetMapping("/fallbacks")
    @Operation(summary = "List fallback modes", description = "Resources currently running in a degraded mode")
    public Mono<ResponseEntity<List<FallbackModeRegistry.FallbackMode>>> listFallbacks() {
        return Mono.fromCallable(() -> ResponseEntity.ok(fallbackModes.list()));
    }

    @GetMapping("/automation-blocks")
    @Operation(summary = "List automation blocks", description = "Resources with automation disabled, by blocking ticket")
    public Mono<ResponseEntity<Map<String, String>>> listAutomationBlocks() {
        return Mono.fromCallable(() -> ResponseEntity.ok(automationGuard.snapshot()));
    }

    // ========== Request DTOs ==========

    @Data
    public static class ResolveRequest {
        @NotBlank
        private String resolvedBy;
        @NotNull
        private EscalationTicket.Resolution resolution;
    }
}
