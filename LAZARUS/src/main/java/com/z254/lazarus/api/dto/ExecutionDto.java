package com.z254.lazarus.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * One remediation attempt.
 */
@Data
@Builder
public class ExecutionDto {
    private String id;
    private String playbookId;
    private int playbookVersion;
    private int attempt;
    private boolean dryRun;
    private boolean success;
    private boolean aborted;
    private boolean changed;
    private String errorKind;
    private String error;
    private String preStateHash;
    private String postStateHash;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private Double mttrSeconds;
    private List<StepDto> steps;

    @Data
    @Builder
    public static class StepDto {
        private int order;
        private String actionId;
        private String status;
        private boolean rolledBack;
        private String errorKind;
        private String error;
        private String detail;
        private Instant startedAt;
        private Instant completedAt;
    }
}
