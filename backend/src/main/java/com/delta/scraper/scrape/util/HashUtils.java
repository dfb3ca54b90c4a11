package com.delta.scraper.scrape.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Order-sensitive fingerprint of an extracted record. Two records with the same field values in the
     * same declaration order hash identically.
     */
    public static String recordFingerprint(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return sha256Hex("");
        }
        StringBuilder canonical = new StringBuilder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            canonical.append(entry.getKey())
                .append('\u001f')
                .append(Objects.toString(entry.getValue(), "\u0000"))
                .append('\u001e');
        }
        return sha256Hex(canonical.toString());
    }
}
