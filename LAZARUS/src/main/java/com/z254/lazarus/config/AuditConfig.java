package com.z254.lazarus.config;

import com.z254.lazarus.audit.AuditChainVerification;
import com.z254.lazarus.audit.AuditLedger;
import com.z254.lazarus.audit.AuditLedgerException;
import com.z254.lazarus.audit.AuditLedgerStore;
import com.z254.lazarus.audit.FileAuditLedgerStore;
import com.z254.lazarus.audit.InMemoryAuditLedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Audit ledger wiring.
 * <p>
 * A file-backed ledger is verified when it is opened; a broken chain stops the application.
 */
@Slf4j
@Configuration
public class AuditConfig {

    @Bean
    public AuditLedgerStore auditLedgerStore(LazarusProperties properties) {
        LazarusProperties.Audit audit = properties.getAudit();
        if (audit.getStore() == LazarusProperties.AuditStore.FILE) {
            log.info("Using file audit ledger at {}", audit.getPath());
            return new FileAuditLedgerStore(Path.of(audit.getPath()));
        }
        return new InMemoryAuditLedgerStore();
    }

    @Bean
    public AuditLedger auditLedger(AuditLedgerStore store) {
        AuditLedger ledger = new AuditLedger(store);
        AuditChainVerification verification = ledger.verify();
        if (!verification.valid()) {
            throw new AuditLedgerException("Audit ledger chain broken at entry "
                    + verification.firstInvalidSequence() + ": " + verification.reason());
        }
        log.info("Audit ledger verified: {} entries", verification.entriesChecked());
        return ledger;
    }
}
