package com.cardledger.backend.dto.reconciliation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lowercase hex SHA-256 of a whole uploaded file.
 */
public record Fingerprint(String hex) {

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    public Fingerprint {
        if (hex == null) {
            throw new IllegalArgumentException("Fingerprint cannot be null");
        }
        hex = hex.trim().toLowerCase(Locale.ROOT);
        if (!SHA256_HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not a SHA-256 hex digest: " + hex);
        }
    }

    @Override
    public String toString() {
        return hex;
    }
}
