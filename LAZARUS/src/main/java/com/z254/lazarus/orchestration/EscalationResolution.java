package com.z254.lazarus.orchestration;

import com.z254.lazarus.domain.model.Incident;
import com.z254.lazarus.escalation.EscalationTicket;

/**
 * A resolved ticket and, for {@code RETRY_REMEDIATION}, the follow-up incident opened for it.
 */
public record EscalationResolution(EscalationTicket ticket, Incident followUp) {
}
