package com.z254.lazarus.api.mapper;

import com.z254.lazarus.api.dto.ExecutionDto;
import com.z254.lazarus.api.dto.IncidentDto;
import com.z254.lazarus.api.dto.IncidentSummaryDto;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.StepResult;

import java.util.List;
import java.util.Map;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentSummaryDto toSummary(Incident incident) {
        return IncidentSummaryDto.builder()
                .id(incident.getId())
                .resourceKey(incident.getResourceKey())
                .kind(incident.getKind())
                .severity(incident.getSeverity().name())
                .status(incident.getStatus().name())
                .playbookId(incident.getPlaybookId())
                .playbookVersion(incident.getPlaybookVersion())
                .attemptCount(incident.getAttemptCount())
                .coalescedCount(incident.getCoalescedCount())
                .detectedAt(incident.getDetectedAt())
                .lastFailureAt(incident.getLastFailureAt())
                .resolvedAt(incident.getResolvedAt())
                .mttrSeconds(incident.getMttrSeconds())
                .escalationTicketId(incident.getEscalationTicketId())
                .parentIncidentId(incident.getParentIncidentId())
                .approved(incident.isApproved())
                .archived(incident.isArchived())
                .build();
    }

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .resourceKey(incident.getResourceKey())
                .kind(incident.getKind())
                .severity(incident.getSeverity().name())
                .status(incident.getStatus().name())
                .detectorId(incident.getDetectorId())
                .playbookId(incident.getPlaybookId())
                .playbookVersion(incident.getPlaybookVersion())
                .attemptCount(incident.getAttemptCount())
                .coalescedCount(incident.getCoalescedCount())
                .detectedAt(incident.getDetectedAt())
                .lastFailureAt(incident.getLastFailureAt())
                .updatedAt(incident.getUpdatedAt())
                .resolvedAt(incident.getResolvedAt())
                .mttrSeconds(incident.getMttrSeconds())
                .escalationTicketId(incident.getEscalationTicketId())
                .parentIncidentId(incident.getParentIncidentId())
                .approved(incident.isApproved())
                .archived(incident.isArchived())
                .context(Map.copyOf(incident.getContext()))
                .executions(incident.getExecutions().stream().map(IncidentMapper::toExecutionDto).toList())
                .timeline(List.copyOf(incident.getTimeline()))
                .build();
    }

    public static ExecutionDto toExecutionDto(ExecutionRecord record) {
        return ExecutionDto.builder()
                .id(record.getId())
                .playbookId(record.getPlaybookId())
                .playbookVersion(record.getPlaybookVersion())
                .attempt(record.getAttempt())
                .dryRun(record.isDryRun())
                .success(record.isSuccess())
                .aborted(record.isAborted())
                .changed(record.isChanged())
                .errorKind(record.getFailure() == null ? null : record.getFailure().kind().name())
                .error(record.getFailure() == null ? null : record.getFailure().message())
                .preStateHash(record.getPreStateHash())
                .postStateHash(record.getPostStateHash())
                .startedAt(record.getStartedAt())
                .completedAt(record.getCompletedAt())
                .durationMs(record.getDuration().toMillis())
                .mttrSeconds(record.getMttrSeconds())
                .steps(record.getStepResults().stream().map(IncidentMapper::toStepDto).toList())
                .build();
    }

    private static ExecutionDto.StepDto toStepDto(StepResult step) {
        return ExecutionDto.StepDto.builder()
                .order(step.getOrder())
                .actionId(step.getActionKind().id())
                .status(step.getStatus().name())
                .rolledBack(step.isRolledBack())
                .errorKind(step.getError() == null ? null : step.getError().kind().name())
                .error(step.getError() == null ? null : step.getError().message())
                .detail(step.getDetail())
                .startedAt(step.getStartedAt())
                .completedAt(step.getCompletedAt())
                .build();
    }
}
