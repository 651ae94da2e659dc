package com.z254.lazarus.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the LAZARUS remediation engine.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Trigger debounce and resource lock policy</li>
 *     <li>Retry backoff for failed remediation attempts</li>
 *     <li>Detector error thresholds</li>
 *     <li>Metric alert thresholds</li>
 *     <li>Audit ledger storage</li>
 *     <li>Governance (change freezes, rate limits)</li>
 *     <li>Control plane and Kafka integration</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "lazarus")
public class LazarusProperties {

    private final Trigger trigger = new Trigger();
    private final Lock lock = new Lock();
    private final Retry retry = new Retry();
    private final Detection detection = new Detection();
    private final Metrics metrics = new Metrics();
    private final Audit audit = new Audit();
    private final Escalation escalation = new Escalation();
    private final Governance governance = new Governance();
    private final ControlPlane controlPlane = new ControlPlane();
    private final Kafka kafka = new Kafka();
    private final Playbooks playbooks = new Playbooks();

    /**
     * Failure correlation settings.
     */
    @Data
    public static class Trigger {
        /** Window in which repeated failures on a resource coalesce into the open incident */
        private Duration cooldown = Duration.ofSeconds(30);
    }

    /**
     * Resource lock table settings.
     */
    @Data
    public static class Lock {
        /** Maximum incidents waiting behind the lock holder of one resource */
        @Positive
        private int queueDepth = 10;

        /** Lease after which an unrenewed lock is reclaimed */
        private Duration leaseTtl = Duration.ofMinutes(5);

        /** Interval of the expired-lease reaper */
        private Duration reaperInterval = Duration.ofSeconds(15);
    }

    /**
     * Backoff between remediation attempts of one incident.
     */
    @Data
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);

        /** Relative jitter applied to each delay (0.2 = +/-20%); below 1/3 delays stay strictly increasing up to the cap */
        @DecimalMin("0.0")
        @DecimalMax("0.33")
        private double jitter = 0.2;
    }

    /**
     * Detector pool settings.
     */
    @Data
    public static class Detection {
        /** Consecutive probe errors after which a detector is disabled */
        @Positive
        private int maxConsecutiveErrors = 5;

        /** Default silence after which a heartbeat detector reports a failure */
        private Duration heartbeatTimeout = Duration.ofSeconds(30);

        /** Default poll interval for detectors registered through the API */
        private Duration defaultPollInterval = Duration.ofSeconds(5);

        /** Heartbeat detectors registered at startup */
        private List<HeartbeatDetectorSpec> heartbeats = new ArrayList<>();

        /** Health endpoint detectors registered at startup */
        private List<HealthEndpointSpec> healthEndpoints = new ArrayList<>();
    }

    @Data
    public static class HeartbeatDetectorSpec {
        @NotBlank
        private String id;
        @NotBlank
        private String resourceKey;
        /** Falls back to {@code detection.heartbeat-timeout} */
        private Duration timeout;
    }

    @Data
    public static class HealthEndpointSpec {
        @NotBlank
        private String id;
        @NotBlank
        private String resourceKey;
        @NotBlank
        private String url;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofSeconds(3);
    }

    /**
     * Success-rate and MTTR alerting.
     */
    @Data
    public static class Metrics {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double successRateFloor = 0.8;

        private Duration mttrP95Ceiling = Duration.ofMinutes(5);

        /** Attempts required before the success-rate floor is evaluated */
        @Positive
        private int minSamples = 5;
    }

    /**
     * Audit ledger storage.
     */
    @Data
    public static class Audit {
        private AuditStore store = AuditStore.MEMORY;

        /** JSON-lines file used when {@code store=FILE} */
        @NotBlank
        private String path = "data/audit-ledger.jsonl";
    }

    /**
     * Escalation defaults.
     */
    @Data
    public static class Escalation {
        /** Enable the resource's fallback mode when retries are exhausted */
        private boolean fallbackOnRetryExhaustion = true;

        /** Enable the resource's fallback mode when a rollback fails */
        private boolean fallbackOnRollbackFailure = true;
    }

    /**
     * Change governance for automated remediation.
     */
    @Data
    public static class Governance {
        /** Periods during which no automated remediation is started */
        private List<FreezePeriod> freezePeriods = new ArrayList<>();

        /** Attempts allowed per resource in a rolling hour */
        @Positive
        private int maxAttemptsPerResourcePerHour = 6;
    }

    @Data
    public static class FreezePeriod {
        private Instant start;
        private Instant end;
        private String reason;
    }

    /**
     * Target of remediation actions.
     */
    @Data
    public static class ControlPlane {
        private ControlPlaneMode mode = ControlPlaneMode.SANDBOX;

        @NotBlank
        private String url = "http://localhost:8090";

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    /**
     * Kafka integration.
     */
    @Data
    public static class Kafka {
        private boolean enabled = false;

        /** Consumer threads for the failure-signal listener */
        @Positive
        private int listenerConcurrency = 3;

        /** Partitions and replicas of topics created at startup */
        @Positive
        private int partitions = 6;
        @Positive
        private int replicas = 1;

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String failureSignals = "lazarus.failures.signals";
            private String escalations = "lazarus.escalations.tickets";
            private String incidentEvents = "lazarus.incidents.events";
        }
    }

    /**
     * Playbook bootstrap.
     */
    @Data
    public static class Playbooks {
        /** Resource pattern of playbook documents loaded at startup */
        private String location = "classpath*:playbooks/*.yml";
    }

    public enum AuditStore {
        MEMORY,
        FILE
    }

    public enum ControlPlaneMode {
        /** In-process simulated resources, with chaos injection */
        SANDBOX,
        /** Remote control plane reached over HTTP */
        HTTP
    }
}
