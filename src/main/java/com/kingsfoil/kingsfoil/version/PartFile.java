package com.kingsfoil.kingsfoil.version;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Identity of one uploaded file: its name, SHA-256 content hash and size in bytes.
 */
public record PartFile(String fileName, String fileHash, long sizeBytes) {

    public static PartFile of(String fileName, byte[] content) {
        return new PartFile(fileName, sha256(content), content.length);
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(content);
            StringBuilder sb = new StringBuilder(hashed.length * 2);
            for (byte b : hashed) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
