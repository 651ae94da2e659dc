package com.z254.lazarus.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * Audit store backed by a JSON-lines file, one entry per line.
 * <p>
 * Existing entries are loaded into memory on construction; every append is written and flushed
 * before it becomes visible to readers.
 */
@Slf4j
public class FileAuditLedgerStore implements AuditLedgerStore {

    private final Path path;
    private final InMemoryAuditLedgerStore cache = new InMemoryAuditLedgerStore();

    public FileAuditLedgerStore(Path path) {
        this.path = path;
        load();
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(AuditJson.MAPPER.writeValueAsString(entry));
            writer.newLine();
        } catch (IOException e) {
            throw new AuditLedgerException("Failed to append audit entry " + entry.sequenceNo()
                    + " to " + path, e);
        }
        cache.append(entry);
    }

    @Override
    public Optional<AuditEntry> last() {
        return cache.last();
    }

    @Override
    public List<AuditEntry> read(long fromSequence, int limit) {
        return cache.read(fromSequence, limit);
    }

    @Override
    public List<AuditEntry> readAll() {
        return cache.readAll();
    }

    @Override
    public long size() {
        return cache.size();
    }

    public Path getPath() {
        return path;
    }

    // ========== Private Methods ==========

    private void load() {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            if (!Files.exists(path)) {
                return;
            }
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            int lineNo = 0;
            for (String line : lines) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                cache.append(parse(line, lineNo));
            }
            log.info("Loaded {} audit entries from {}", cache.size(), path);
        } catch (IOException e) {
            throw new AuditLedgerException("Failed to read audit ledger " + path, e);
        }
    }

    private AuditEntry parse(String line, int lineNo) {
        try {
            return AuditJson.MAPPER.readValue(line, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new AuditLedgerException("Corrupt audit ledger line " + lineNo + " in " + path, e);
        }
    }
}
