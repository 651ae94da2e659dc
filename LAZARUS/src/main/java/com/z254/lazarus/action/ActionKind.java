package com.z254.lazarus.action;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of remediation actions a playbook step may reference.
 * <p>
 * Playbook documents name actions by their lower-case id, e.g. {@code release_storage_lock}.
 */
public enum ActionKind {
    RESTART_SERVICE,
    RELEASE_STORAGE_LOCK,
    CLEAR_CACHE,
    SCALE_WORKERS,
    SHED_LOAD,
    RESET_CONNECTION_POOL,
    RESYNC_DEPENDENCIES,
    FLUSH_CIRCUIT_BREAKERS,
    NOTIFY_OPERATOR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve an action id, accepting either case and dashes for underscores.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static ActionKind fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Action id is required");
        }
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return ActionKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action '" + id + "', expected one of "
                    + Arrays.stream(values()).map(ActionKind::id).collect(Collectors.joining(", ")));
        }
    }
}
