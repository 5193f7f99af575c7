package com.embedcache.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    void testRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of(new byte[16]));
    }

    @Test
    void testDefensiveCopies() {
        byte[] digest = new byte[CacheKey.LENGTH];
        CacheKey key = CacheKey.of(digest);

        digest[0] = 42;
        assertEquals(0, key.toBytes()[0]);

        key.toBytes()[1] = 7;
        assertEquals(0, key.toBytes()[1]);
    }

    @Test
    void testValueEquality() {
        byte[] digest = new byte[CacheKey.LENGTH];
        digest[5] = (byte) 0xff;
        assertEquals(CacheKey.of(digest), CacheKey.of(digest.clone()));
        assertEquals("0000000000ff" + "00".repeat(26), CacheKey.of(digest).toString());
    }
}
