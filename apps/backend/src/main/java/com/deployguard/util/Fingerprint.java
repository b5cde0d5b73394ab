package com.deployguard.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Fingerprint {
    private Fingerprint() {}

    public static final String ALGORITHM = "SHA-256";

    /** Hex SHA-256 of the UTF-8 bytes of {@code s}. */
    public static String sha256(String s) {
        return HexFormat.of().formatHex(digest(s.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }
}
