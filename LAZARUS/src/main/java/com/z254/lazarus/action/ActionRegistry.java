package com.z254.lazarus.action;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binds every {@link ActionKind} to its {@link RemediationAction}.
 * <p>
 * Playbook steps are resolved against this registry when they are published, so an unsupported
 * capability is rejected before anything runs.
 */
@Slf4j
@Component
public class ActionRegistry {

    public static final String STATUS = "status";
    public static final String STORAGE_LOCK = "storage_lock";
    public static final String CACHE = "cache";
    public static final String WORKERS = "workers";
    public static final String LOAD_SHEDDING = "load_shedding";
    public static final String CONNECTION_POOL = "connection_pool";
    public static final String DEPENDENCIES = "dependencies";
    public static final String CIRCUIT_BREAKERS = "circuit_breakers";

    private final Map<ActionKind, RemediationAction> actions = new EnumMap<>(ActionKind.class);

    public ActionRegistry(ControlPlane controlPlane) {
        // a restart and a cache flush cannot be undone
        register(new AttributeAction(ActionKind.RESTART_SERVICE, STATUS, "UP", false, controlPlane));
        register(new AttributeAction(ActionKind.RELEASE_STORAGE_LOCK, STORAGE_LOCK, "free", true, controlPlane));
        register(new AttributeAction(ActionKind.CLEAR_CACHE, CACHE, "fresh", false, controlPlane));
        register(new AttributeAction(ActionKind.SCALE_WORKERS, WORKERS,
                ctx -> ctx.parameter("replicas", "4"), true, controlPlane));
        register(new AttributeAction(ActionKind.SHED_LOAD, LOAD_SHEDDING, "on", true, controlPlane));
        register(new AttributeAction(ActionKind.RESET_CONNECTION_POOL, CONNECTION_POOL, "healthy", true, controlPlane));
        register(new AttributeAction(ActionKind.RESYNC_DEPENDENCIES, DEPENDENCIES, "synced", true, controlPlane));
        register(new AttributeAction(ActionKind.FLUSH_CIRCUIT_BREAKERS, CIRCUIT_BREAKERS, "closed", true, controlPlane));
        register(new NotifyOperatorAction());
    }

    /**
     * Replace the action bound to a kind.
     */
    public void register(RemediationAction action) {
        actions.put(action.kind(), action);
        log.debug("Registered action {} (verify={}, rollback={}, dryRun={})", action.kind().id(),
                action.supportsVerify(), action.supportsRollback(), action.supportsDryRun());
    }

    public RemediationAction get(ActionKind kind) {
        RemediationAction action = actions.get(kind);
        if (action == null) {
            throw new IllegalStateException("No action bound to " + kind);
        }
        return action;
    }

    public Map<ActionKind, RemediationAction> all() {
        return Collections.unmodifiableMap(actions);
    }
}
