package com.embedcache.service.canonicalization;

import com.embedcache.model.CacheKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKeyDeriver.
 */
class CacheKeyDeriverTest {

    private CacheKeyDeriver keyDeriver;

    @BeforeEach
    void setUp() {
        keyDeriver = new CacheKeyDeriver();
    }

    @Test
    void testHelloWorldIsSha256() {
        CacheKey key = keyDeriver.deriveKey("hello world");
        assertEquals("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9", key.toHex());
        assertEquals(CacheKey.LENGTH, key.toBytes().length);
    }

    @Test
    void testEmptyStringHasOwnKey() {
        CacheKey key = keyDeriver.deriveKey("");
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", key.toHex());
    }

    @Test
    void testDeterministic() {
        String text = "The quick brown fox jumps over the lazy dog";
        assertEquals(keyDeriver.deriveKey(text), keyDeriver.deriveKey(text));
        assertEquals(keyDeriver.deriveKey(text).hashCode(), keyDeriver.deriveKey(text).hashCode());
    }

    @Test
    void testNoNormalization() {
        // Whitespace, case and unicode form all change the key
        assertNotEquals(keyDeriver.deriveKey("hello world"), keyDeriver.deriveKey("hello world "));
        assertNotEquals(keyDeriver.deriveKey("hello world"), keyDeriver.deriveKey("Hello world"));
        assertNotEquals(keyDeriver.deriveKey("hello\nworld"), keyDeriver.deriveKey("hello world"));
        assertNotEquals(keyDeriver.deriveKey("caf\u00e9"), keyDeriver.deriveKey("cafe\u0301"));
    }

    @Test
    void testKeySizeIndependentOfInputLength() {
        String longText = "lorem ipsum ".repeat(10_000);
        assertEquals(CacheKey.LENGTH, keyDeriver.deriveKey(longText).toBytes().length);
    }

    @Test
    void testNoCollisionsAcrossCorpus() {
        Set<CacheKey> keys = new HashSet<>();
        int corpusSize = 50_000;
        for (int i = 0; i < corpusSize; i++) {
            keys.add(keyDeriver.deriveKey("document-" + i));
        }
        assertEquals(corpusSize, keys.size());
    }

    @Test
    void testNullTextRejected() {
        assertThrows(NullPointerException.class, () -> keyDeriver.deriveKey(null));
    }
}
