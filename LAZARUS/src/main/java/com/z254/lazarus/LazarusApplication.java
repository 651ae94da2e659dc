package com.z254.lazarus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * LAZARUS - Autonomous incident detection and remediation engine.
 *
 * <p>LAZARUS provides:
 * <ul>
 *   <li>Detection - Pluggable detectors polling resources for faults</li>
 *   <li>Triggering - Failure correlation, debounce and playbook selection</li>
 *   <li>Remediation - Verified, rollback-capable playbook execution under per-resource locks</li>
 *   <li>Escalation - Operator tickets, fallback modes and approvals</li>
 *   <li>Accountability - Hash-chained audit ledger and MTTR metrics</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class LazarusApplication {

    public static void main(String[] args) {
        SpringApplication.run(LazarusApplication.class, args);
    }
}
