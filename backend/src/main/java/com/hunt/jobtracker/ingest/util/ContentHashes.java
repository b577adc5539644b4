package com.hunt.jobtracker.ingest.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class ContentHashes {
    private ContentHashes() {
    }

    /**
     * SHA-256 of the text with whitespace runs collapsed, so re-fetches that only differ in
     * layout hash the same.
     */
    public static String snapshotHash(String text) {
        String normalized = text == null ? "" : text.strip().replaceAll("\\s+", " ");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
