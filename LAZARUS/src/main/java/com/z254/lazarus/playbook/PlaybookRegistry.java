package com.z254.lazarus.playbook;

import com.z254.lazarus.action.ActionRegistry;
import com.z254.lazarus.action.RemediationAction;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.domain.model.Failure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Versioned store of published playbooks and selector for failures.
 * <p>
 * Publication is a correctness gate: a playbook is only stored when every step's declared
 * capabilities are consistent and supported by the bound action. Published versions never change.
 */
@Slf4j
@Component
public class PlaybookRegistry {

    /** Candidate order: priority desc, then most recently published first */
    static final Comparator<Playbook> SELECTION_ORDER = Comparator
            .comparingInt(Playbook::getPriority).reversed()
            .thenComparing(Playbook::getPublishedAt, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingLong(Playbook::getPublishSequence).reversed());

    private final ActionRegistry actionRegistry;
    private final AuditLedger auditLedger;
    private final Map<String, NavigableMap<Integer, Playbook>> playbooks = new ConcurrentHashMap<>();
    private final AtomicLong publishSequence = new AtomicLong();

    public PlaybookRegistry(ActionRegistry actionRegistry, AuditLedger auditLedger) {
        this.actionRegistry = actionRegistry;
        this.auditLedger = auditLedger;
    }

    /**
     * Validate and store a new playbook version.
     *
     * @return the stored playbook, stamped with its publication time
     * @throws PlaybookValidationException if the playbook is rejected
     */
    public synchronized Playbook publish(Playbook playbook) {
        List<String> violations = validate(playbook);
        if (!violations.isEmpty()) {
            auditLedger.append("registry", "playbook_rejected", Map.of(
                    "playbookId", String.valueOf(playbook.getId()),
                    "version", playbook.getVersion(),
                    "violations", violations));
            log.warn("Rejected playbook {}: {}", playbook.getId(), violations);
            throw new PlaybookValidationException(String.valueOf(playbook.getId()), violations);
        }

        Playbook published = playbook.toBuilder()
                .publishedAt(Instant.now())
                .publishSequence(publishSequence.incrementAndGet())
                .build();

        auditLedger.append("registry", "playbook_published", Map.of(
                "playbookId", published.getId(),
                "version", published.getVersion(),
                "priority", published.getPriority(),
                "steps", published.getSteps().size()));
        playbooks.computeIfAbsent(published.getId(), k -> new TreeMap<>()).put(published.getVersion(), published);

        log.info("Published playbook {} (priority={}, steps={})",
                published.ref(), published.getPriority(), published.getSteps().size());
        return published;
    }

    /**
     * Latest versions of all playbooks whose trigger pattern matches the failure, best first.
     */
    public List<Playbook> lookup(Failure failure) {
        return latestVersions().stream()
                .filter(p -> p.getTriggerPattern().matches(failure))
                .sorted(SELECTION_ORDER)
                .toList();
    }

    /**
     * Latest version of a playbook.
     */
    public Optional<Playbook> get(String id) {
        NavigableMap<Integer, Playbook> versions = playbooks.get(id);
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (this) {
            return versions.isEmpty() ? Optional.empty() : Optional.of(versions.lastEntry().getValue());
        }
    }

    public Optional<Playbook> get(String id, int version) {
        NavigableMap<Integer, Playbook> versions = playbooks.get(id);
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (this) {
            return Optional.ofNullable(versions.get(version));
        }
    }

    public synchronized List<Playbook> versions(String id) {
        NavigableMap<Integer, Playbook> versions = playbooks.get(id);
        return versions == null ? List.of() : List.copyOf(versions.values());
    }

    /**
     * Latest version of every playbook, in selection order.
     */
    public List<Playbook> list() {
        return latestVersions().stream().sorted(SELECTION_ORDER).toList();
    }

    /**
     * Summary of the registry contents, for health reporting.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("playbooks", playbooks.size());
        summary.put("versions", playbooks.values().stream().mapToInt(Map::size).sum());
        return summary;
    }

    // ========== Private Methods ==========

    private synchronized List<Playbook> latestVersions() {
        List<Playbook> latest = new ArrayList<>();
        playbooks.values().forEach(versions -> latest.add(versions.lastEntry().getValue()));
        return latest;
    }

    private List<String> validate(Playbook playbook) {
        List<String> violations = new ArrayList<>();
        if (playbook.getId() == null || playbook.getId().isBlank()) {
            violations.add("id is required");
        }
        if (playbook.getName() == null || playbook.getName().isBlank()) {
            violations.add("name is required");
        }
        if (playbook.getVersion() < 1) {
            violations.add("version must be at least 1");
        }
        if (playbook.getTriggerPattern() == null) {
            violations.add("trigger_pattern is required");
        }
        if (playbook.getMaxRetries() < 1) {
            violations.add("max_retries must be at least 1");
        }
        if (playbook.getSteps() == null || playbook.getSteps().isEmpty()) {
            violations.add("at least one step is required");
        } else {
            playbook.getSteps().forEach(step -> validateStep(step, violations));
        }

        if (playbook.getId() != null) {
            NavigableMap<Integer, Playbook> versions = playbooks.get(playbook.getId());
            if (versions != null && !versions.isEmpty() && playbook.getVersion() <= versions.lastKey()) {
                violations.add("version " + playbook.getVersion() + " must be greater than published version "
                        + versions.lastKey());
            }
        }
        return violations;
    }

    private void validateStep(PlaybookStep step, List<String> violations) {
        String prefix = "step " + step.getOrder() + " (" + step.getActionKind() + "): ";
        if (step.getActionKind() == null) {
            violations.add(prefix + "action is required");
            return;
        }
        if (step.getTimeout() == null || step.getTimeout().isNegative() || step.getTimeout().isZero()) {
            violations.add(prefix + "timeout must be positive");
        }
        if (step.isHasRollback() && !step.isHasVerify()) {
            violations.add(prefix + "declares rollback without verify");
        }
        RemediationAction action = actionRegistry.get(step.getActionKind());
        if (step.isHasVerify() && !action.supportsVerify()) {
            violations.add(prefix + "action does not support verify");
        }
        if (step.isHasRollback() && !action.supportsRollback()) {
            violations.add(prefix + "action does not support rollback");
        }
        if (step.isHasDryRun() && !action.supportsDryRun()) {
            violations.add(prefix + "action does not support dry run");
        }
    }
}
