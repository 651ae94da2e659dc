package com.z254.lazarus.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Fault signal submitted by an external collaborator, over REST or Kafka.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureSignalRequest {

    /** Reporting source; defaults to the ingestion channel */
    private String detectorId;

    @NotBlank
    private String resourceKey;

    @NotBlank
    private String kind;

    /** LOW, MEDIUM, HIGH or CRITICAL; MEDIUM when absent */
    private String severity;

    /** Observation time; now when absent */
    private Instant detectedAt;

    private Map<String, String> context;
}
