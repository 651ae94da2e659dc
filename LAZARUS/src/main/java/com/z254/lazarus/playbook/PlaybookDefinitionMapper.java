package com.z254.lazarus.playbook;

import com.z254.lazarus.action.ActionKind;
import com.z254.lazarus.domain.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Converts between playbook documents and published {@link Playbook}s.
 */
public final class PlaybookDefinitionMapper {

    static final int DEFAULT_MAX_RETRIES = 3;

    private PlaybookDefinitionMapper() {
    }

    /**
     * Build a playbook from its document. Structural problems (unknown action ids, malformed
     * trigger patterns, unknown tiers) are collected and reported together.
     *
     * @throws PlaybookValidationException when the document cannot be converted
     */
    public static Playbook toPlaybook(PlaybookDefinition definition) {
        String id = definition.getId() == null ? "<unnamed>" : definition.getId();
        List<String> violations = new ArrayList<>();

        TriggerPattern pattern = toTriggerPattern(definition.getTriggerPattern(), violations);
        AutonomyTier tier = toTier(definition.getAutonomyTier(), violations);

        List<PlaybookStep> steps = new ArrayList<>();
        List<PlaybookDefinition.StepDefinition> stepDefinitions =
                definition.getSteps() == null ? List.of() : definition.getSteps();
        for (int i = 0; i < stepDefinitions.size(); i++) {
            PlaybookDefinition.StepDefinition step = stepDefinitions.get(i);
            ActionKind kind;
            try {
                kind = ActionKind.fromId(step.getActionId());
            } catch (IllegalArgumentException e) {
                violations.add("step " + (i + 1) + ": " + e.getMessage());
                continue;
            }
            steps.add(PlaybookStep.builder()
                    .order(i + 1)
                    .actionKind(kind)
                    .timeout(step.getTimeoutMs() == null ? null : Duration.ofMillis(step.getTimeoutMs()))
                    .hasVerify(step.isHasVerify())
                    .hasRollback(step.isHasRollback())
                    .hasDryRun(step.isHasDryRun())
                    .description(step.getDescription())
                    .parameters(step.getParameters() == null ? Map.of() : Map.copyOf(step.getParameters()))
                    .build());
        }

        if (!violations.isEmpty()) {
            throw new PlaybookValidationException(id, violations);
        }

        return Playbook.builder()
                .id(definition.getId())
                .name(definition.getName())
                .version(definition.getVersion() == null ? 0 : definition.getVersion())
                .description(definition.getDescription())
                .triggerPattern(pattern)
                .priority(definition.getPriority() == null ? 0 : definition.getPriority())
                .maxRetries(definition.getMaxRetries() == null ? DEFAULT_MAX_RETRIES : definition.getMaxRetries())
                .requiresApproval(Boolean.TRUE.equals(definition.getRequiresApproval()))
                .autonomyTier(tier)
                .steps(List.copyOf(steps))
                .build();
    }

    public static PlaybookDefinition toDefinition(Playbook playbook) {
        TriggerPattern pattern = playbook.getTriggerPattern();
        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("kind", pattern.getKind());
        if (pattern.getResource() != null) {
            trigger.put("resource", pattern.getResource());
        }
        if (!pattern.getContext().isEmpty()) {
            trigger.put("context", pattern.getContext());
        }
        if (pattern.getMinSeverity() != null) {
            trigger.put("min_severity", pattern.getMinSeverity().name().toLowerCase(Locale.ROOT));
        }

        List<PlaybookDefinition.StepDefinition> steps = playbook.getSteps().stream()
                .map(step -> PlaybookDefinition.StepDefinition.builder()
                        .actionId(step.getActionKind().id())
                        .timeoutMs(step.getTimeout().toMillis())
                        .hasVerify(step.isHasVerify())
                        .hasRollback(step.isHasRollback())
                        .hasDryRun(step.isHasDryRun())
                        .description(step.getDescription())
                        .parameters(step.getParameters())
                        .build())
                .toList();

        return PlaybookDefinition.builder()
                .id(playbook.getId())
                .name(playbook.getName())
                .version(playbook.getVersion())
                .description(playbook.getDescription())
                .triggerPattern(trigger)
                .priority(playbook.getPriority())
                .maxRetries(playbook.getMaxRetries())
                .requiresApproval(playbook.isRequiresApproval())
                .autonomyTier(playbook.getAutonomyTier().name().toLowerCase(Locale.ROOT))
                .steps(new ArrayList<>(steps))
                .build();
    }

    // ========== Private Methods ==========

    private static TriggerPattern toTriggerPattern(Object raw, List<String> violations) {
        try {
            if (raw instanceof String kind) {
                return TriggerPattern.kind(kind);
            }
            if (raw instanceof Map<?, ?> map) {
                Object kind = map.get("kind");
                if (!(kind instanceof String kindRegex)) {
                    violations.add("trigger_pattern.kind is required");
                    return null;
                }
                Object resource = map.get("resource");
                Map<String, String> context = new LinkedHashMap<>();
                if (map.get("context") instanceof Map<?, ?> ctx) {
                    ctx.forEach((k, v) -> context.put(String.valueOf(k), String.valueOf(v)));
                }
                Severity minSeverity = null;
                Object severity = map.get("min_severity");
                if (severity != null) {
                    minSeverity = Severity.valueOf(severity.toString().trim().toUpperCase(Locale.ROOT));
                }
                return TriggerPattern.of(kindRegex, resource == null ? null : resource.toString(),
                        context, minSeverity);
            }
            violations.add("trigger_pattern is required");
        } catch (PatternSyntaxException e) {
            violations.add("trigger_pattern does not compile: " + e.getDescription());
        } catch (IllegalArgumentException e) {
            violations.add("trigger_pattern.min_severity is invalid: " + e.getMessage());
        }
        return null;
    }

    private static AutonomyTier toTier(String raw, List<String> violations) {
        if (raw == null || raw.isBlank()) {
            return AutonomyTier.FULLY_AUTOMATIC;
        }
        try {
            return AutonomyTier.valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            violations.add("unknown autonomy_tier '" + raw + "'");
            return AutonomyTier.FULLY_AUTOMATIC;
        }
    }
}
