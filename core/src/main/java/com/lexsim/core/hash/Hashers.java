package com.lexsim.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for entity placement and assignment fingerprints.
 * <p>
 * <b>Important:</b> {@link #polynomial31(String)} is the placement hash. Its output for a given
 * entity ID must never change between releases, otherwise a recomputed assignment would
 * disagree with one computed before a restart. Murmur3 is only used for fingerprints.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Polynomial rolling hash over the UTF-8 bytes of {@code str}:
     * {@code h = h * 31 + b}, starting at 0, with unsigned 64-bit wraparound.
     * <p>
     * The returned long carries the unsigned value's bits; use {@link #bucket(long, int)}
     * to reduce it to a partition index.
     * </p>
     *
     * @param str Input string
     * @return 64-bit hash (unsigned semantics)
     */
    public static long polynomial31(String str) {
        long hash = 0L;
        for (byte b : str.getBytes(StandardCharsets.UTF_8)) {
            hash = hash * 31 + (b & 0xFF);
        }
        return hash;
    }

    /**
     * Reduces an unsigned 64-bit hash into {@code [0, buckets)}.
     *
     * @param hash    Hash bits, interpreted as unsigned
     * @param buckets Number of buckets, must be positive
     * @return Bucket index
     */
    public static int bucket(long hash, int buckets) {
        return (int) Long.remainderUnsigned(hash, buckets);
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        HashCode hash = Hashing.murmur3_128().hashBytes(data);
        return hash.asLong();
    }

    /**
     * Computes Murmur3 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 64-bit hash value
     */
    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Converts a long to a fixed-width lowercase hex string.
     */
    public static String toHex(long value) {
        return String.format("%016x", value);
    }
}
