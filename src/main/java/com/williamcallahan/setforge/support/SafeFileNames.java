package com.williamcallahan.setforge.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives filesystem-safe file names from work item identities.
 *
 * Item identities are relative paths or arbitrary strings; the readable part is kept for
 * operators and a short hash keeps distinct identities from colliding after sanitizing.
 */
public final class SafeFileNames {

    private static final int MAX_READABLE_LENGTH = 80;
    private static final int HASH_PREFIX_LENGTH = 12;

    private SafeFileNames() {
        // Utility class - no instantiation
    }

    /**
     * Converts an identity into a file name stem containing only {@code [A-Za-z0-9._-]}.
     *
     * @param identity work item identity
     * @return sanitized stem with a hash suffix
     */
    public static String toSafeStem(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity must not be blank");
        }
        String readable = identity.replaceAll("[^A-Za-z0-9._-]", "_");
        if (readable.length() > MAX_READABLE_LENGTH) {
            readable = readable.substring(0, MAX_READABLE_LENGTH);
        }
        return readable + "-" + shortHash(identity);
    }

    private static String shortHash(String identity) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(identity.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_PREFIX_LENGTH);
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 not available", exception);
        }
    }
}
