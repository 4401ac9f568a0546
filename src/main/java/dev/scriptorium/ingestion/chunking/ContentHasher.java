package dev.scriptorium.ingestion.chunking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 fingerprints of chunk text, stored with each chunk as {@code content_hash}. */
public final class ContentHasher {

    private ContentHasher() {
        // utility class
    }

    /**
     * Hash text as UTF-8.
     *
     * @param content the content to hash
     * @return lowercase hex SHA-256 digest
     */
    public static String sha256(String content) {
        try {
            byte[] hash =
                    MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
