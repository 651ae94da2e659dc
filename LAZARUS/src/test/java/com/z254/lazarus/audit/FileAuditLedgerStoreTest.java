package com.z254.lazarus.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileAuditLedgerStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void entriesSurviveReloadAndStillVerify() {
        Path file = tempDir.resolve("ledger/audit.jsonl");
        AuditLedger ledger = new AuditLedger(new FileAuditLedgerStore(file));
        ledger.append("trigger", "incident_opened", Map.of("incidentId", "i-1", "severity", "HIGH"));
        ledger.append("executor", "step_succeeded", Map.of("step", 1, "durationMs", 12L, "ratio", 0.5));

        AuditLedger reloaded = new AuditLedger(new FileAuditLedgerStore(file));

        assertThat(reloaded.size()).isEqualTo(2);
        assertThat(reloaded.verify().valid()).isTrue();

        AuditEntry third = reloaded.append("executor", "step_failed", Map.of());
        assertThat(third.sequenceNo()).isEqualTo(3);
        assertThat(third.prevHash()).isEqualTo(reloaded.entries(2, 1).get(0).hash());
    }

    @Test
    void editedLineIsDetectedAfterReload() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLedger ledger = new AuditLedger(new FileAuditLedgerStore(file));
        ledger.append("operator", "incident_approved", Map.of("approver", "alice"));
        ledger.append("operator", "abort_requested", Map.of("actor", "bob"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        lines.set(0, lines.get(0).replace("alice", "mallory"));
        Files.write(file, lines, StandardCharsets.UTF_8);

        AuditChainVerification result = new AuditLedger(new FileAuditLedgerStore(file)).verify();

        assertThat(result.valid()).isFalse();
        assertThat(result.firstInvalidSequence()).isEqualTo(1L);
    }

    @Test
    void corruptLineFailsLoad() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        Files.writeString(file, "{not json\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new FileAuditLedgerStore(file))
                .isInstanceOf(AuditLedgerException.class)
                .hasMessageContaining("line 1");
    }
}
