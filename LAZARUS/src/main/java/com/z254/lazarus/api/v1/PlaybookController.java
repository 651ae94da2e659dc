package com.z254.lazarus.api.v1;

import com.z254.lazarus.api.dto.ExecutionDto;
import com.z254.lazarus.api.dto.PlaybookDto;
import com.z254.lazarus.api.mapper.IncidentMapper;
import com.z254.lazarus.api.mapper.PlaybookMapper;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.orchestration.IncidentOrchestrator;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.PlaybookDefinition;
import com.z254.lazarus.playbook.PlaybookDefinitionMapper;
import com.z254.lazarus.playbook.PlaybookRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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

/**
 * REST API controller for the playbook registry.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/playbooks")
@Tag(name = "Playbooks", description = "Playbook publication, lookup and dry runs")
public class PlaybookController {

    private final PlaybookRegistry playbookRegistry;
    private final IncidentOrchestrator orchestrator;

    public PlaybookController(PlaybookRegistry playbookRegistry, IncidentOrchestrator orchestrator) {
        this.playbookRegistry = playbookRegistry;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    @Operation(summary = "List playbooks", description = "Latest version of every playbook")
    public Mono<ResponseEntity<List<PlaybookDto>>> listPlaybooks() {
        return Mono.fromCallable(() -> ResponseEntity.ok(playbookRegistry.list().stream()
                .map(PlaybookMapper::toDto)
                .toList()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get playbook", description = "Latest version, or the given version")
    public Mono<ResponseEntity<PlaybookDto>> getPlaybook(
            @Parameter(description = "Playbook ID") @PathVariable String id,
            @Parameter(description = "Version") @RequestParam(required = false) Integer version) {

        return Mono.justOrEmpty(version == null ? playbookRegistry.get(id) : playbookRegistry.get(id, version))
                .map(PlaybookMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/versions")
    @Operation(summary = "List versions", description = "Every published version of a playbook, oldest first")
    public Mono<ResponseEntity<List<PlaybookDto>>> listVersions(
            @Parameter(description = "Playbook ID") @PathVariable String id) {

        return Mono.fromCallable(() -> {
            List<Playbook> versions = playbookRegistry.versions(id);
            if (versions.isEmpty()) {
                throw new NotFoundException("Playbook", id);
            }
            return ResponseEntity.ok(versions.stream().map(PlaybookMapper::toDto).toList());
        });
    }

    @PostMapping
    @Operation(summary = "Publish playbook",
               description = "Publish a new playbook or a new version of an existing one (snake_case document)")
    public Mono<ResponseEntity<PlaybookDto>> publish(@RequestBody PlaybookDefinition definition) {
        return Mono.fromCallable(() -> {
            Playbook published = playbookRegistry.publish(PlaybookDefinitionMapper.toPlaybook(definition));
            log.info("Published playbook {} over API", published.ref());
            return ResponseEntity.status(HttpStatus.CREATED).body(PlaybookMapper.toDto(published));
        });
    }

    @PostMapping("/{id}/dry-run")
    @Operation(summary = "Dry run", description = "Run only the dry-run checks of a playbook against a resource")
    public Mono<ResponseEntity<ExecutionDto>> dryRun(
            @Parameter(description = "Playbook ID") @PathVariable String id,
            @Validated @RequestBody DryRunRequest request) {

        return orchestrator.dryRun(id, request.getResourceKey())
                .map(IncidentMapper::toExecutionDto)
                .map(ResponseEntity::ok);
    }

    // ========== Request DTOs ==========

    @Data
    public static class DryRunRequest {
        @NotBlank
        private String resourceKey;
    }
}
