package com.z254.lazarus.playbook;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A published, immutable remediation recipe. A change is published as a new version.
 */
@Value
@Builder(toBuilder = true)
public class Playbook {
    String id;
    String name;
    int version;
    String description;
    TriggerPattern triggerPattern;
    int priority;

    /** Total number of attempts allowed for one incident */
    @Builder.Default
    int maxRetries = 3;

    boolean requiresApproval;

    @Builder.Default
    AutonomyTier autonomyTier = AutonomyTier.FULLY_AUTOMATIC;

    @Builder.Default
    List<PlaybookStep> steps = List.of();

    /** Set by the registry on publication */
    Instant publishedAt;

    /** Publication order across all playbooks, breaks ties between equal timestamps */
    long publishSequence;

    /**
     * Whether an operator must approve before the playbook runs.
     */
    public boolean needsApproval() {
        return requiresApproval || autonomyTier == AutonomyTier.APPROVAL_REQUIRED;
    }

    public String ref() {
        return id + "@v" + version;
    }
}
