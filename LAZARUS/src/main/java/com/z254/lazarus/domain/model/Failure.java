package com.z254.lazarus.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One raw observation of a fault, emitted by a detector and consumed once by the trigger engine.
 */
@Value
@Builder(toBuilder = true)
public class Failure {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    /** Detector (or external source) that observed the fault */
    String detectorId;

    /** Key of the resource the fault concerns, e.g. {@code db} */
    String resourceKey;

    /** Fault kind, e.g. {@code heartbeat_timeout} */
    String kind;

    @Builder.Default
    Severity severity = Severity.MEDIUM;

    @Builder.Default
    Instant detectedAt = Instant.now();

    @Builder.Default
    Map<String, String> context = Map.of();
}
