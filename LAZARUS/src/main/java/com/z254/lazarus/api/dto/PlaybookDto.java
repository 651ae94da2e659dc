package com.z254.lazarus.api.dto;

import com.z254.lazarus.playbook.PlaybookDefinition;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Published playbook version.
 */
@Data
@Builder
public class PlaybookDto {
    private String id;
    private String name;
    private int version;
    private String description;
    private String triggerPattern;
    private int priority;
    private int maxRetries;
    private boolean requiresApproval;
    private String autonomyTier;
    private Instant publishedAt;
    private List<PlaybookDefinition.StepDefinition> steps;
}
