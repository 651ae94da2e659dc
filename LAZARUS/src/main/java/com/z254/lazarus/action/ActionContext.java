package com.z254.lazarus.action;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-step execution context handed to a {@link RemediationAction}.
 * <p>
 * {@link #getCaptured()} holds the attribute values an action replaced, so that its rollback can
 * restore them. A fresh context is created for every step of every attempt.
 */
@Getter
@Builder
public class ActionContext {

    private final String incidentId;
    private final String resourceKey;

    @Builder.Default
    private final Map<String, String> parameters = Map.of();

    @Builder.Default
    private final Map<String, String> captured = new ConcurrentHashMap<>();

    public String parameter(String name, String defaultValue) {
        return parameters.getOrDefault(name, defaultValue);
    }
}
