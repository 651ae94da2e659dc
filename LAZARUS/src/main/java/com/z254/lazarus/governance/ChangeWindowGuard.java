package com.z254.lazarus.governance;

import com.z254.lazarus.config.LazarusProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Enforces change-freeze periods for automated remediation.
 * <p>
 * Freeze periods come from {@code lazarus.governance.freeze-periods} and can be added at runtime.
 * While a freeze is active no remediation attempt is started.
 */
@Slf4j
@Component
public class ChangeWindowGuard {

    private final List<FreezePeriod> freezePeriods = new CopyOnWriteArrayList<>();

    public ChangeWindowGuard(LazarusProperties properties) {
        properties.getGovernance().getFreezePeriods().forEach(fp -> addFreezePeriod(FreezePeriod.builder()
                .start(fp.getStart())
                .end(fp.getEnd())
                .reason(fp.getReason())
                .build()));
    }

    public WindowCheck check() {
        return check(Instant.now());
    }

    /**
     * Check whether remediation may start at the given time.
     */
    public WindowCheck check(Instant timestamp) {
        Optional<FreezePeriod> activeFreeze = freezePeriods.stream()
                .filter(fp -> !timestamp.isBefore(fp.getStart()) && timestamp.isBefore(fp.getEnd()))
                .findFirst();
        if (activeFreeze.isPresent()) {
            return WindowCheck.builder()
                    .allowed(false)
                    .reason("In freeze period: " + activeFreeze.get().getReason())
                    .nextAllowedTime(activeFreeze.get().getEnd())
                    .build();
        }
        return WindowCheck.builder()
                .allowed(true)
                .reason("No freeze active")
                .build();
    }

    public void addFreezePeriod(FreezePeriod freezePeriod) {
        if (freezePeriod.getStart() == null || freezePeriod.getEnd() == null
                || !freezePeriod.getEnd().isAfter(freezePeriod.getStart())) {
            throw new IllegalArgumentException("Freeze period needs a start before its end");
        }
        freezePeriods.add(freezePeriod);
        log.info("Added freeze period: {} - {} ({})",
                freezePeriod.getStart(), freezePeriod.getEnd(), freezePeriod.getReason());
    }

    public List<FreezePeriod> getFreezePeriods() {
        return List.copyOf(freezePeriods);
    }

    // ========== Data Classes ==========

    @Data
    @Builder
    public static class FreezePeriod {
        private Instant start;
        private Instant end;
        private String reason;
    }

    @Data
    @Builder
    public static class WindowCheck {
        private boolean allowed;
        private String reason;
        private Instant nextAllowedTime;
    }
}
