package com.lexsim.core.hash;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashersTest {

    @Test
    void testPolynomial31_KnownValues() {
        assertEquals(0L, Hashers.polynomial31(""));
        assertEquals(97L, Hashers.polynomial31("a"));
        assertEquals(97L * 31 + 98, Hashers.polynomial31("ab"));
        // 'e' = 101, '0' = 48
        assertEquals(101L * 31 + 48, Hashers.polynomial31("e0"));
    }

    @Test
    void testPolynomial31_UsesUnsignedUtf8Bytes() {
        // U+00E9 encodes as 0xC3 0xA9
        assertEquals(195L * 31 + 169, Hashers.polynomial31("é"));
    }

    @Test
    void testPolynomial31_WrapsLikeUnsigned64Bit() {
        String id = "jurisdiction/statute/section-00042/paragraph-7";

        BigInteger modulus = BigInteger.ONE.shiftLeft(64);
        BigInteger expected = BigInteger.ZERO;
        for (byte b : id.getBytes(StandardCharsets.UTF_8)) {
            expected = expected.multiply(BigInteger.valueOf(31)).add(BigInteger.valueOf(b & 0xFF)).mod(modulus);
        }

        long hash = Hashers.polynomial31(id);
        assertEquals(expected, new BigInteger(Long.toUnsignedString(hash)));

        for (int buckets = 1; buckets <= 17; buckets++) {
            int bucket = Hashers.bucket(hash, buckets);
            assertEquals(expected.mod(BigInteger.valueOf(buckets)).intValue(), bucket);
            assertTrue(bucket >= 0 && bucket < buckets);
        }
    }

    @Test
    void testMurmur3_StableAndHexPadded() {
        long first = Hashers.murmur3Hash("layout");
        assertEquals(first, Hashers.murmur3Hash("layout".getBytes(StandardCharsets.UTF_8)));
        assertNotEquals(first, Hashers.murmur3Hash("layout2"));

        assertEquals("000000000000000f", Hashers.toHex(15L));
        assertEquals(16, Hashers.toHex(first).length());
    }
}
