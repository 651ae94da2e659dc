package com.z254.lazarus.domain.model;

import com.z254.lazarus.action.ActionKind;
import com.z254.lazarus.remediation.StepError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of one step of an execution attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepResult {
    private int order;
    private ActionKind actionKind;
    private StepStatus status;
    private StepError error;
    private boolean rolledBack;
    private String detail;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }

    public boolean isChanged() {
        return status == StepStatus.SUCCEEDED;
    }
}
