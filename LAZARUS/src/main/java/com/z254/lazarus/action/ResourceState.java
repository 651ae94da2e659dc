package com.z254.lazarus.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of a managed resource as reported by the control plane.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceState {

    private String resourceKey;

    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    private Instant observedAt;

    public String attribute(String name) {
        return attributes.get(name);
    }

    /**
     * SHA-256 over the attributes in key order. Two snapshots with equal attributes hash equally.
     */
    public String stateHash() {
        StringBuilder canonical = new StringBuilder(resourceKey == null ? "" : resourceKey);
        new TreeMap<>(attributes).forEach((k, v) -> canonical.append('\n').append(k).append('=').append(v));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
