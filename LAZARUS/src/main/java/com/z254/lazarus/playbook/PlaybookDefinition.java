package com.z254.lazarus.playbook;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Playbook document as written in YAML or posted as JSON (snake_case keys).
 * <pre>
 * id: db_recovery
 * name: Database recovery
 * version: 1
 * trigger_pattern: heartbeat_timeout          # or {kind, resource, context, min_severity}
 * priority: 10
 * max_retries: 3
 * requires_approval: false
 * autonomy_tier: fully_automatic
 * steps:
 *   - action_id: release_storage_lock
 *     timeout_ms: 5000
 *     has_verify: true
 *     has_rollback: true
 *     has_dry_run: true
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaybookDefinition {
    private String id;
    private String name;
    private Integer version;
    private String description;

    /** Kind regex, or a map with {@code kind}, {@code resource}, {@code context}, {@code min_severity} */
    private Object triggerPattern;

    private Integer priority;
    private Integer maxRetries;
    private Boolean requiresApproval;
    private String autonomyTier;

    @Builder.Default
    private List<StepDefinition> steps = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StepDefinition {
        private String actionId;
        private Long timeoutMs;
        private boolean hasVerify;
        private boolean hasRollback;
        private boolean hasDryRun;
        private String description;
        private Map<String, String> parameters;
    }
}
