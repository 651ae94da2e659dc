package com.z254.lazarus.playbook;

import com.z254.lazarus.action.ActionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * One step of a playbook: an action bound to its declared capabilities.
 */
@Value
@Builder
public class PlaybookStep {
    int order;
    ActionKind actionKind;
    Duration timeout;
    boolean hasVerify;
    boolean hasRollback;
    boolean hasDryRun;
    String description;

    @Builder.Default
    Map<String, String> parameters = Map.of();
}
