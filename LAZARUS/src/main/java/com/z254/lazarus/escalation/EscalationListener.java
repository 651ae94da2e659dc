package com.z254.lazarus.escalation;

/**
 * Receives ticket events after they were audited.
 */
public interface EscalationListener {

    void onTicketEvent(EscalationTicket ticket, String eventType);
}
