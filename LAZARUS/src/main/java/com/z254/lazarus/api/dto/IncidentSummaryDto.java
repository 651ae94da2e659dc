package com.z254.lazarus.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Incident as listed by the API.
 */
@Data
@Builder
public class IncidentSummaryDto {
    private String id;
    private String resourceKey;
    private String kind;
    private String severity;
    private String status;
    private String playbookId;
    private int playbookVersion;
    private int attemptCount;
    private int coalescedCount;
    private Instant detectedAt;
    private Instant lastFailureAt;
    private Instant resolvedAt;
    private Double mttrSeconds;
    private String escalationTicketId;
    private String parentIncidentId;
    private boolean approved;
    private boolean archived;
}
