package com.z254.lazarus.detection;

import com.z254.lazarus.domain.model.Failure;

import java.time.Duration;
import java.util.Optional;

/**
 * Observation-only probe of one resource. Detectors never act on what they observe.
 */
public interface Detector {

    /** Unique detector id */
    String id();

    /** Detector type, e.g. {@code heartbeat} */
    String kind();

    Duration pollInterval();

    String targetResourceKey();

    /**
     * Check the resource once.
     *
     * @return a failure if the resource is faulty
     * @throws DetectionException if the check itself could not be carried out
     */
    Optional<Failure> probe();
}
