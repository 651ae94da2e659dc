package com.z254.lazarus.api.mapper;

import com.z254.lazarus.api.dto.FailureSignalRequest;
import com.z254.lazarus.api.dto.TriggerDecisionDto;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.Severity;
import com.z254.lazarus.trigger.TriggerDecision;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Conversion between external fault signals and {@link Failure}s.
 */
public final class SignalMapper {

    private SignalMapper() {}

    /**
     * @param defaultSource detector id used when the signal names none
     * @throws IllegalArgumentException on an unknown severity
     */
    public static Failure toFailure(FailureSignalRequest request, String defaultSource) {
        return Failure.builder()
                .detectorId(request.getDetectorId() == null || request.getDetectorId().isBlank()
                        ? defaultSource : request.getDetectorId())
                .resourceKey(request.getResourceKey())
                .kind(request.getKind())
                .severity(severity(request.getSeverity()))
                .detectedAt(request.getDetectedAt() == null ? Instant.now() : request.getDetectedAt())
                .context(request.getContext() == null ? Map.of() : Map.copyOf(request.getContext()))
                .build();
    }

    public static TriggerDecisionDto toDto(Failure failure, TriggerDecision decision) {
        return TriggerDecisionDto.builder()
                .failureId(failure.getId())
                .outcome(decision.outcome().name())
                .incidentId(decision.incidentId())
                .playbookId(decision.playbook() == null ? null : decision.playbook().getId())
                .lockOutcome(decision.lockResult() == null ? null : decision.lockResult().outcome().name())
                .queuePosition(decision.lockResult() == null || decision.lockResult().position() == 0
                        ? null : decision.lockResult().position())
                .reason(decision.reason())
                .build();
    }

    private static Severity severity(String value) {
        if (value == null || value.isBlank()) {
            return Severity.MEDIUM;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity '" + value + "', expected one of "
                    + Arrays.toString(Severity.values()));
        }
    }
}
