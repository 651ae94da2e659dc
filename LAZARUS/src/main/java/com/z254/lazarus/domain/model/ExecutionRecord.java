package com.z254.lazarus.domain.model;

import com.z254.lazarus.remediation.StepError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One remediation attempt of a playbook against an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {
    private String id;
    private String incidentId;
    private String resourceKey;
    private String playbookId;
    private int playbookVersion;
    private int attempt;
    private boolean dryRun;
    private boolean aborted;

    @Builder.Default
    private List<StepResult> stepResults = new ArrayList<>();

    private Instant startedAt;
    private Instant completedAt;
    private boolean success;

    /** First failing step error, if any */
    private StepError failure;

    /** Resource state hash before the attempt */
    private String preStateHash;

    /** Resource state hash after the attempt */
    private String postStateHash;

    /** Whether any step changed the resource */
    private boolean changed;

    /** Set on the attempt that resolved the incident */
    private Double mttrSeconds;

    public boolean isRollbackFailed() {
        return failure != null && failure.isFatal();
    }

    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
