package com.z254.lazarus.api.dto;

import com.z254.lazarus.escalation.EscalationTicket;
import lombok.Builder;
import lombok.Data;

/**
 * Resolved ticket and the follow-up incident opened by the resolution, if any.
 */
@Data
@Builder
public class EscalationResolutionResponse {
    private EscalationTicket ticket;
    private IncidentSummaryDto followUp;
}
