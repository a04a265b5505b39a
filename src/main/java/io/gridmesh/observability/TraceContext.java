package io.gridmesh.observability;

import java.security.SecureRandom;

public final class TraceContext {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContext() {
    }

    public static String newTraceId() {
        return randomHex(16);
    }

    // Accepts a caller-supplied id only when it looks like one of ours.
    public static String orNew(String candidate) {
        if (candidate != null && candidate.matches("[0-9a-f]{32}")) {
            return candidate;
        }
        return newTraceId();
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
