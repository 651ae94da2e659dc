package com.z254.lazarus.audit;

import com.z254.lazarus.common.LazarusException;

/**
 * Raised when the ledger cannot be written or read back.
 */
public class AuditLedgerException extends LazarusException {

    public AuditLedgerException(String message) {
        super(message);
    }

    public AuditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
