package com.z254.lazarus.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * How a submitted failure was handled.
 */
@Data
@Builder
public class TriggerDecisionDto {
    private String failureId;
    private String outcome;
    private String incidentId;
    private String playbookId;
    private String lockOutcome;
    private Integer queuePosition;
    private String reason;
}
