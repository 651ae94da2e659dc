package com.z254.lazarus.escalation;

import com.z254.lazarus.common.LazarusException;

/**
 * Raised when a ticket or approval request does not fit the ticket's current state.
 */
public class EscalationStateException extends LazarusException {

    public EscalationStateException(String message) {
        super(message);
    }
}
