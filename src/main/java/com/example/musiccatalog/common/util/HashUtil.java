package com.example.musiccatalog.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    public static final int DEFAULT_BUFFER_SIZE = 4096;

    private HashUtil() {
    }

    public static String md5Hex(String text) {
        return toHex(newDigest("MD5").digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Streams the file through SHA-256 in chunks of {@code bufferSize} bytes.
     */
    public static String sha256Hex(Path file, int bufferSize) throws IOException {
        MessageDigest messageDigest = newDigest("SHA-256");
        byte[] buffer = new byte[bufferSize > 0 ? bufferSize : DEFAULT_BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                messageDigest.update(buffer, 0, read);
            }
        }
        return toHex(messageDigest.digest());
    }

    public static String sha256Hex(Path file) throws IOException {
        return sha256Hex(file, DEFAULT_BUFFER_SIZE);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not found", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
