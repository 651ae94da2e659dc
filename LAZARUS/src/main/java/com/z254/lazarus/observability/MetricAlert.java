package com.z254.lazarus.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Alert raised when remediation quality of a playbook or fault kind crosses a threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricAlert {
    private String id;
    private AlertType type;
    private ScopeType scopeType;
    private String scope;
    private double value;
    private double threshold;
    private Instant raisedAt;
    private Instant clearedAt;
    private String message;

    public boolean isActive() {
        return clearedAt == null;
    }

    public enum AlertType {
        SUCCESS_RATE_BELOW_FLOOR,
        MTTR_P95_ABOVE_CEILING
    }

    public enum ScopeType {
        PLAYBOOK,
        KIND
    }
}
