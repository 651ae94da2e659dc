package com.z254.lazarus.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AuditLedgerTest {

    private InMemoryAuditLedgerStore store;
    private AuditLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryAuditLedgerStore();
        ledger = new AuditLedger(store, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        void firstEntryLinksToGenesis() {
            AuditEntry entry = ledger.append("trigger", "incident_opened", Map.of("incidentId", "i-1"));

            assertThat(entry.sequenceNo()).isEqualTo(1);
            assertThat(entry.prevHash()).isEqualTo("0".repeat(64));
            assertThat(entry.hash()).hasSize(64).isNotEqualTo(entry.prevHash());
        }

        @Test
        void entriesAreChainedInSequence() {
            AuditEntry first = ledger.append("a", "one", Map.of());
            AuditEntry second = ledger.append("a", "two", Map.of("n", 2));
            AuditEntry third = ledger.append("b", "three", null);

            assertThat(second.sequenceNo()).isEqualTo(2);
            assertThat(second.prevHash()).isEqualTo(first.hash());
            assertThat(third.prevHash()).isEqualTo(second.hash());
            assertThat(third.payload()).isEmpty();
            assertThat(ledger.size()).isEqualTo(3);
        }

        @Test
        void payloadIsReducedToPlainValues() {
            AuditEntry entry = ledger.append("a", "step_rolled_back",
                    Map.of("at", Instant.parse("2026-01-01T00:00:05Z"), "steps", List.of(1, 2)));

            assertThat(entry.payload().get("at")).isEqualTo("2026-01-01T00:00:05Z");
            assertThat(entry.payload().get("steps")).isEqualTo(List.of(1, 2));
        }

        @Test
        void concurrentAppendsKeepSequenceContiguous() throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(200);
            for (int i = 0; i < 200; i++) {
                int n = i;
                pool.submit(() -> {
                    ledger.append("worker", "tick", Map.of("n", n));
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            pool.shutdown();

            assertThat(ledger.size()).isEqualTo(200);
            assertThat(ledger.verify().valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("entries")
    class Entries {

        @Test
        void pagesFromSequenceNumber() {
            for (int i = 0; i < 10; i++) {
                ledger.append("a", "e" + i, Map.of());
            }

            List<AuditEntry> page = ledger.entries(4, 3);

            assertThat(page).extracting(AuditEntry::sequenceNo).containsExactly(4L, 5L, 6L);
            assertThat(ledger.entries(11, 5)).isEmpty();
            assertThat(ledger.entries(0, 0)).hasSize(10);
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        void validChain() {
            ledger.append("a", "one", Map.of("k", "v"));
            ledger.append("a", "two", Map.of());

            AuditChainVerification result = ledger.verify();

            assertThat(result.valid()).isTrue();
            assertThat(result.entriesChecked()).isEqualTo(2);
            assertThat(result.firstInvalidSequence()).isNull();
        }

        @Test
        void detectsModifiedPayload() {
            TamperableStore tamperable = new TamperableStore();
            AuditLedger tamperedLedger = new AuditLedger(tamperable);
            tamperedLedger.append("a", "one", Map.of("k", "v"));
            AuditEntry second = tamperedLedger.append("a", "two", Map.of("k", "v"));
            tamperedLedger.append("a", "three", Map.of());

            tamperable.replace(1, new AuditEntry(second.sequenceNo(), second.prevHash(), second.hash(),
                    second.timestamp(), second.actor(), second.action(), Map.of("k", "forged")));

            AuditChainVerification result = tamperedLedger.verify();

            assertThat(result.valid()).isFalse();
            assertThat(result.firstInvalidSequence()).isEqualTo(2L);
            assertThat(result.reason()).isEqualTo("hash mismatch");
        }

        @Test
        void detectsRemovedEntry() {
            TamperableStore tamperable = new TamperableStore();
            AuditLedger tamperedLedger = new AuditLedger(tamperable);
            tamperedLedger.append("a", "one", Map.of());
            tamperedLedger.append("a", "two", Map.of());
            tamperedLedger.append("a", "three", Map.of());

            tamperable.remove(1);

            AuditChainVerification result = tamperedLedger.verify();

            assertThat(result.valid()).isFalse();
            assertThat(result.firstInvalidSequence()).isEqualTo(3L);
        }
    }

    /** Store that allows the modifications the ledger itself never makes. */
    private static class TamperableStore implements AuditLedgerStore {
        private final List<AuditEntry> entries = new ArrayList<>();

        void replace(int index, AuditEntry entry) {
            entries.set(index, entry);
        }

        void remove(int index) {
            entries.remove(index);
        }

        @Override
        public void append(AuditEntry entry) {
            entries.add(entry);
        }

        @Override
        public Optional<AuditEntry> last() {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
        }

        @Override
        public List<AuditEntry> read(long fromSequence, int limit) {
            return entries.stream().filter(e -> e.sequenceNo() >= fromSequence).limit(limit).toList();
        }

        @Override
        public List<AuditEntry> readAll() {
            return List.copyOf(entries);
        }

        @Override
        public long size() {
            return entries.size();
        }
    }
}
