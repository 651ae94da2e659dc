package com.z254.lazarus.action;

import com.z254.lazarus.common.LazarusException;

/**
 * Raised when the control plane rejects or cannot serve a request.
 */
public class ControlPlaneException extends LazarusException {

    public ControlPlaneException(String message) {
        super(message);
    }

    public ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
    }
}
