package com.z254.lazarus.domain.service;

import com.z254.lazarus.audit.AuditEntry;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.audit.InMemoryAuditLedgerStore;
import com.z254.lazarus.common.NotFoundException;
import com.z254.lazarus.domain.model.ExecutionRecord;
import com.z254.lazarus.domain.model.Failure;
import com.z254.lazarus.domain.model.IllegalIncidentTransitionException;
import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.domain.model.IncidentStatus;
import com.z254.lazarus.domain.model.Severity;
import com.z254.lazarus.domain.repository.InMemoryIncidentRepository;
import com.z254.lazarus.observability.LazarusStructuredLogger;
import com.z254.lazarus.observability.RemediationMetrics;
import com.z254.lazarus.playbook.Playbook;
import com.z254.lazarus.playbook.TriggerPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IncidentServiceTest {

    @Mock
    private RemediationMetrics metrics;

    private AuditLedger auditLedger;
    private List<String> events;
    private IncidentService incidentService;
    private Playbook playbook;

    @BeforeEach
    void setUp() {
        auditLedger = new AuditLedger(new InMemoryAuditLedgerStore());
        events = new ArrayList<>();
        IncidentEventListener recorder = (incident, type) -> events.add(incident.getId() + ":" + type);
        IncidentEventListener broken = (incident, type) -> {
            throw new IllegalStateException("listener down");
        };
        incidentService = new IncidentService(new InMemoryIncidentRepository(), auditLedger, metrics,
                new LazarusStructuredLogger(), List.of(broken, recorder));
        playbook = Playbook.builder()
                .id("db_recovery")
                .name("db")
                .version(2)
                .triggerPattern(TriggerPattern.kind("heartbeat_timeout"))
                .build();
    }

    @Test
    void openCreatesDetectedIncidentFromFailure() {
        Incident incident = incidentService.open("INC-1", failure(Severity.HIGH, Instant.now()), playbook);

        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.DETECTED);
        assertThat(incident.getPlaybookId()).isEqualTo("db_recovery");
        assertThat(incident.getPlaybookVersion()).isEqualTo(2);
        assertThat(incident.getContext()).containsEntry("region", "eu");
        assertThat(incidentService.findActive("db")).map(Incident::getId).contains("INC-1");
        assertThat(events).containsExactly("INC-1:opened");
        verify(metrics).recordIncidentOpened();
    }

    @Test
    void coalesceKeepsStatusAndRaisesSeverity() {
        Instant first = Instant.now();
        incidentService.open("INC-1", failure(Severity.MEDIUM, first), playbook);

        Incident incident = incidentService.coalesce("INC-1", failure(Severity.CRITICAL, first.plusSeconds(5)));

        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.DETECTED);
        assertThat(incident.getCoalescedCount()).isEqualTo(1);
        assertThat(incident.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(incident.getLastFailureAt()).isEqualTo(first.plusSeconds(5));
        assertThat(incident.getAttemptCount()).isZero();
    }

    @Test
    void illegalTransitionIsRejectedAndNotAudited() {
        incidentService.open("INC-1", failure(Severity.HIGH, Instant.now()), playbook);
        long before = auditLedger.size();

        assertThatThrownBy(() -> incidentService.transition("INC-1", IncidentStatus.RESOLVED, "test", null))
                .isInstanceOf(IllegalIncidentTransitionException.class);
        assertThat(auditLedger.size()).isEqualTo(before);
        assertThat(incidentService.require("INC-1").getStatus()).isEqualTo(IncidentStatus.DETECTED);
    }

    @Test
    void resolveComputesMttrFromDetectionAndStampsLastExecution() {
        Instant detectedAt = Instant.now().minus(Duration.ofSeconds(90));
        incidentService.open("INC-1", failure(Severity.HIGH, detectedAt), playbook);
        incidentService.transition("INC-1", IncidentStatus.ANALYZING, "test", null);
        incidentService.transition("INC-1", IncidentStatus.REMEDIATING, "test", null);
        assertThat(incidentService.beginAttempt("INC-1")).hasValue(1);
        incidentService.recordExecution("INC-1", ExecutionRecord.builder()
                .id("x-1").attempt(1).playbookId("db_recovery").success(true).build());
        incidentService.transition("INC-1", IncidentStatus.VERIFYING, "test", null);

        Incident resolved = incidentService.resolve("INC-1");

        assertThat(resolved.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(resolved.isArchived()).isTrue();
        assertThat(resolved.getMttrSeconds()).isGreaterThanOrEqualTo(90.0);
        assertThat(resolved.lastExecution().getMttrSeconds()).isEqualTo(resolved.getMttrSeconds());
        assertThat(incidentService.findActive("db")).isEmpty();
        verify(metrics).recordIncidentResolved(any(Duration.class));
        assertThat(auditLedger.entries()).extracting(AuditEntry::action)
                .contains("incident_opened", "attempt_started", "execution_recorded", "incident_resolved");
    }

    @Test
    void escalateLinksTicket() {
        incidentService.open("INC-1", failure(Severity.HIGH, Instant.now()), playbook);
        incidentService.transition("INC-1", IncidentStatus.ANALYZING, "test", null);

        Incident escalated = incidentService.escalate("INC-1", "T-1", "HUMAN_MANDATORY");

        assertThat(escalated.getStatus()).isEqualTo(IncidentStatus.ESCALATED);
        assertThat(escalated.getEscalationTicketId()).isEqualTo("T-1");
        verify(metrics).recordIncidentEscalated("HUMAN_MANDATORY");
    }

    @Test
    void attemptIsNotStartedOutsideRemediating() {
        incidentService.open("INC-1", failure(Severity.HIGH, Instant.now()), playbook);
        incidentService.transition("INC-1", IncidentStatus.ANALYZING, "test", null);
        incidentService.escalate("INC-1", "T-1", "OPERATOR_ABORT");

        assertThat(incidentService.beginAttempt("INC-1")).isEmpty();
        assertThat(incidentService.require("INC-1").getAttemptCount()).isZero();
        assertThat(auditLedger.entries()).extracting(AuditEntry::action).doesNotContain("attempt_started");
    }

    @Test
    void executionOfEscalatedIncidentIsRefused() {
        incidentService.open("INC-1", failure(Severity.HIGH, Instant.now()), playbook);
        incidentService.transition("INC-1", IncidentStatus.ANALYZING, "test", null);
        incidentService.transition("INC-1", IncidentStatus.REMEDIATING, "test", null);
        incidentService.beginAttempt("INC-1");
        incidentService.escalate("INC-1", "T-1", "OPERATOR_ABORT");

        assertThatThrownBy(() -> incidentService.recordExecution("INC-1", ExecutionRecord.builder()
                .id("x-1").attempt(1).playbookId("db_recovery").success(true).build()))
                .isInstanceOf(IllegalIncidentTransitionException.class);
        assertThat(incidentService.require("INC-1").getExecutions()).isEmpty();
    }

    @Test
    void followUpKeepsOriginalDetectionTime() {
        Instant detectedAt = Instant.now().minusSeconds(300);
        Incident parent = incidentService.open("INC-1", failure(Severity.HIGH, detectedAt), playbook);

        Incident followUp = incidentService.openFollowUp("INC-2", parent, playbook, true, "alice");

        assertThat(followUp.getParentIncidentId()).isEqualTo("INC-1");
        assertThat(followUp.getDetectedAt()).isEqualTo(detectedAt);
        assertThat(followUp.isApproved()).isTrue();
        assertThat(incidentService.history("db")).extracting(Incident::getId).containsExactly("INC-1", "INC-2");
    }

    @Test
    void unknownIncidentIsNotFound() {
        assertThatThrownBy(() -> incidentService.note("nope", Incident.TimelineEventType.APPROVED, "x", "y"))
                .isInstanceOf(NotFoundException.class);
    }

    private static Failure failure(Severity severity, Instant detectedAt) {
        return Failure.builder()
                .detectorId("hb-db")
                .resourceKey("db")
                .kind("heartbeat_timeout")
                .severity(severity)
                .detectedAt(detectedAt)
                .context(Map.of("region", "eu"))
                .build();
    }
}
