package com.z254.lazarus.escalation;

import com.z254.lazarus.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator ticket created when automation hands an incident over.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationTicket {
    private String id;
    private String incidentId;
    private String resourceKey;
    private String playbookId;
    private EscalationReason reason;
    private Severity severity;

    @Builder.Default
    private TicketStatus status = TicketStatus.OPEN;

    private Instant createdAt;
    private Instant resolvedAt;
    private String resolvedBy;
    private Resolution resolution;

    /** Whether a degraded fallback mode was switched on for the resource */
    private boolean fallbackEnabled;
    private String fallbackCapability;

    /** Failures that arrived while automation was disabled for the resource */
    private int suppressedFailures;

    @Builder.Default
    private Map<String, Object> rootCauseContext = new LinkedHashMap<>();

    @Builder.Default
    private List<String> suggestedSteps = new ArrayList<>();

    public boolean isOpen() {
        return status == TicketStatus.OPEN;
    }

    public enum TicketStatus {
        OPEN,
        RESOLVED
    }

    public enum Resolution {
        /** Disable fallback and re-enable automation */
        RESTORE_NORMAL,
        /** As RESTORE_NORMAL, then run one more remediation attempt */
        RETRY_REMEDIATION
    }
}
