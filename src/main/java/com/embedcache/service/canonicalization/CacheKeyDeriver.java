package com.embedcache.service.canonicalization;

import com.embedcache.model.CacheKey;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Derives cache keys from raw text.
 *
 * The key is the SHA-256 digest of the exact UTF-8 bytes; no whitespace or case
 * normalization is applied, so texts that differ in any byte get different keys.
 * The embedding model is not part of the key.
 */
@Service
public class CacheKeyDeriver {

    /**
     * @param text input text, may be empty
     * @return 32-byte key
     */
    public CacheKey deriveKey(String text) {
        Objects.requireNonNull(text, "text");
        return CacheKey.of(DigestUtils.sha256(text.getBytes(StandardCharsets.UTF_8)));
    }
}
