package com.company.alerting.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stable identity hash for "the same problem" across repeated alert arrivals.
 *
 * Identity fields, in this order: source, name, service, host, labels.
 * Severity, description, annotations and timestamps are not part of the identity.
 */
public final class FingerprintUtils {

    public static final int FINGERPRINT_LENGTH = 16;

    /** Labels that change on every evaluation. */
    private static final Set<String> VOLATILE_LABELS =
            Set.of("timestamp", "value", "description", "summary", "generatorURL");

    private FingerprintUtils() {
    }

    /**
     * Never throws: missing fields hash as empty strings so ingestion is never blocked.
     */
    public static String fingerprint(String source, String name, String service,
                                     String host, Map<String, String> labels) {
        StringBuilder canonical = new StringBuilder(128);
        append(canonical, source);
        append(canonical, name);
        append(canonical, service);
        append(canonical, host);

        TreeMap<String, String> sorted = new TreeMap<>();
        if (labels != null) {
            labels.forEach((key, value) -> {
                if (key != null && !VOLATILE_LABELS.contains(key)) {
                    sorted.put(key, value == null ? "" : value);
                }
            });
        }
        canonical.append(sorted.size()).append('#');
        sorted.forEach((key, value) -> {
            append(canonical, key);
            append(canonical, value);
        });

        return sha256Hex(canonical.toString()).substring(0, FINGERPRINT_LENGTH);
    }

    // Length-prefixed so that ("ab", "c") and ("a", "bc") never collide
    private static void append(StringBuilder canonical, String value) {
        String v = value == null ? "" : value;
        canonical.append(v.length()).append(':').append(v).append('|');
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
