package com.z254.lazarus.detection;

import com.z254.lazarus.common.LazarusException;

/**
 * A detector could not complete its probe. Repeated occurrences disable the detector.
 */
public class DetectionException extends LazarusException {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
