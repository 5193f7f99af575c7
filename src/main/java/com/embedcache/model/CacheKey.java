package com.embedcache.model;

import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size cache key: the SHA-256 digest of the UTF-8 encoded input text.
 */
public final class CacheKey {

    public static final int LENGTH = 32;

    private final byte[] digest;

    private CacheKey(byte[] digest) {
        this.digest = digest;
    }

    public static CacheKey of(byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Cache key must be " + LENGTH + " bytes, got " + digest.length);
        }
        return new CacheKey(digest.clone());
    }

    /**
     * @return a copy of the raw digest bytes
     */
    public byte[] toBytes() {
        return digest.clone();
    }

    public String toHex() {
        return Hex.encodeHexString(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        return Arrays.equals(digest, ((CacheKey) o).digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
