package com.z254.lazarus.api.v1;

import com.z254.lazarus.audit.AuditChainVerification;
import com.z254.lazarus.audit.AuditEntry;
import com.z254.lazarus.audit.AuditLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only access to the hash-chained audit ledger.
 */
@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Audit ledger reads and chain verification")
public class AuditController {

    private final AuditLedger auditLedger;

    public AuditController(AuditLedger auditLedger) {
        this.auditLedger = auditLedger;
    }

    @GetMapping
    @Operation(summary = "Read entries", description = "Entries in sequence order starting at a sequence number")
    public Mono<ResponseEntity<List<AuditEntry>>> entries(
            @Parameter(description = "First sequence number") @RequestParam(defaultValue = "1") long from,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "100") int limit) {

        return Mono.fromCallable(() -> ResponseEntity.ok(auditLedger.entries(from, limit)));
    }

    @GetMapping("/verify")
    @Operation(summary = "Verify chain", description = "Recompute every hash and report the first broken entry")
    public Mono<ResponseEntity<AuditChainVerification>> verify() {
        return Mono.fromCallable(() -> ResponseEntity.ok(auditLedger.verify()));
    }
}
