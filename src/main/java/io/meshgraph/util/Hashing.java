package io.meshgraph.util;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashing {
    private Hashing() {
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input == null ? new byte[0] : input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * First eight bytes of the SHA-256 digest as a big-endian long.
     */
    public static long sha256Long(byte[] input) {
        return ByteBuffer.wrap(sha256(input), 0, Long.BYTES).getLong();
    }
}
