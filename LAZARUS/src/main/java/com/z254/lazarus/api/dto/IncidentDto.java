package com.z254.lazarus.api.dto;

import com.z254.lazarus.domain.model.Incident;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full incident record, including every execution and the timeline.
 */
@Data
@Builder
public class IncidentDto {
    private String id;
    private String resourceKey;
    private String kind;
    private String severity;
    private String status;
    private String detectorId;
    private String playbookId;
    private int playbookVersion;
    private int attemptCount;
    private int coalescedCount;
    private Instant detectedAt;
    private Instant lastFailureAt;
    private Instant updatedAt;
    private Instant resolvedAt;
    private Double mttrSeconds;
    private String escalationTicketId;
    private String parentIncidentId;
    private boolean approved;
    private boolean archived;
    private Map<String, String> context;
    private List<ExecutionDto> executions;
    private List<Incident.TimelineEvent> timeline;
}
