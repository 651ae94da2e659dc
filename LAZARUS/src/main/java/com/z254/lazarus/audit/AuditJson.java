package com.z254.lazarus.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON encoding and hashing of audit entries.
 * <p>
 * Map keys are sorted at every level so that the same record always encodes to the same bytes,
 * before and after a round trip through the ledger file.
 */
final class AuditJson {

    static final String GENESIS_HASH = "0".repeat(64);

    static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private AuditJson() {
    }

    /**
     * Reduce an arbitrary payload to plain JSON values (maps, lists, strings, numbers, booleans).
     */
    static Map<String, Object> normalize(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }
        return MAPPER.convertValue(payload, MAP_TYPE);
    }

    static String hash(String prevHash, AuditEntry entry) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("sequenceNo", entry.sequenceNo());
        canonical.put("timestamp", entry.timestamp().toString());
        canonical.put("actor", entry.actor());
        canonical.put("action", entry.action());
        canonical.put("payload", entry.payload());
        try {
            String json = MAPPER.writeValueAsString(canonical);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(prevHash.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new AuditLedgerException("Failed to encode audit entry " + entry.sequenceNo(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
