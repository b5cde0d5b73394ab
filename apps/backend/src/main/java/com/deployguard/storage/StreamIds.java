package com.deployguard.storage;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Stream naming shared by the stores that live on the same backend.
 * <p>
 * A name becomes one path segment through {@link #safe}: characters in {@code [A-Za-z0-9_-]}
 * and non-leading dots are kept, every other UTF-8 byte is written as {@code %XX}. The mapping
 * is injective, so two different names never share a stream, and {@link #name} reverses it.
 */
public final class StreamIds {
    private StreamIds() {}

    public static final String AUDIT = "audit/";
    public static final String BASELINE = "baseline/";
    public static final String SNAPSHOT = "snapshot/";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public static String audit(String chainId) {
        return AUDIT + safe(chainId);
    }

    public static String baseline(String name) {
        return BASELINE + safe(name);
    }

    public static String snapshot(String name) {
        return SNAPSHOT + safe(name);
    }

    public static String safe(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("stream name must not be blank");
        StringBuilder sb = new StringBuilder(s.length());
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xff;
            boolean keep = (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9')
                    || b == '_' || b == '-' || (b == '.' && i > 0);
            if (keep) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0f]);
            }
        }
        return sb.toString();
    }

    /** Original name of a stream id produced under {@code prefix}. */
    public static String name(String prefix, String streamId) {
        if (!streamId.startsWith(prefix)) {
            throw new IllegalArgumentException("stream '" + streamId + "' is not under '" + prefix + "'");
        }
        return URLDecoder.decode(streamId.substring(prefix.length()), StandardCharsets.UTF_8);
    }
}
