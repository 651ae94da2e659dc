package com.z254.lazarus.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for incident list.
 */
@Data
@Builder
public class IncidentListResponse {
    private List<IncidentSummaryDto> incidents;
    private long total;
}
