package com.z254.lazarus.action;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Target of remediation actions: reads and updates managed resources.
 */
public interface ControlPlane {

    Mono<ResourceState> snapshot(String resourceKey);

    /**
     * Apply attribute changes and return the resulting state.
     */
    Mono<ResourceState> apply(String resourceKey, Map<String, String> changes);
}
