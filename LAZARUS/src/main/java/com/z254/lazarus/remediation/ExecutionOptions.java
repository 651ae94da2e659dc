package com.z254.lazarus.remediation;

import com.z254.lazarus.lock.ResourceLock;
import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Mono;

/**
 * Per-attempt execution settings.
 */
@Value
@Builder
public class ExecutionOptions {

    /** Run only the dry-run checks of each step */
    boolean dryRun;

    /** Attempt number, starting at 1 */
    @Builder.Default
    int attempt = 1;

    /** Lock held for the attempt; its lease is renewed at every step. Null for dry runs. */
    ResourceLock lock;

    /** Completes when an operator aborts the attempt */
    @Builder.Default
    Mono<Void> abortSignal = Mono.never();

    public static ExecutionOptions dryRun() {
        return ExecutionOptions.builder().dryRun(true).build();
    }
}
