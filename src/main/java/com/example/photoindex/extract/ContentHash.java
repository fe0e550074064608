package com.example.photoindex.extract;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints as lowercase hex.
 */
public final class ContentHash {
    private ContentHash() {}

    /** Hash of the decoded pixels together with their dimensions. */
    public static String of(DecodedImage image) {
        MessageDigest digest = sha256();
        digest.update(ByteBuffer.allocate(12)
                .putInt(image.getWidth())
                .putInt(image.getHeight())
                .putInt(image.getChannels())
                .array());
        digest.update(image.pixels());
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String of(String text) {
        return HexFormat.of().formatHex(sha256().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
