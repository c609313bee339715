package com.aceengine.core.filesystem;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers. All digests are lowercase hex with no algorithm prefix.
 */
public final class ContentHasher {

    public static final String PREFIX = "sha256:";

    private static final int BUFFER_SIZE = 64 * 1024;

    private ContentHasher() {}

    public static String sha256(byte[] bytes) {
        return HexFormat.of().formatHex(digest().digest(bytes));
    }

    /** Hash of the UTF-8 encoding of {@code content}. */
    public static String sha256(String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest md = digest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /** Removes a leading "sha256:" if present. */
    public static String stripPrefix(String hash) {
        if (hash == null) return null;
        return hash.startsWith(PREFIX) ? hash.substring(PREFIX.length()) : hash;
    }

    public static String shortHash(String hash, int length) {
        if (hash == null) return "";
        return hash.length() <= length ? hash : hash.substring(0, length);
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
