package com.z254.lazarus.common;

/**
 * Base class of the engine's domain exceptions.
 */
public class LazarusException extends RuntimeException {

    public LazarusException(String message) {
        super(message);
    }

    public LazarusException(String message, Throwable cause) {
        super(message, cause);
    }
}
