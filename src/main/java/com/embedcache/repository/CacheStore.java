package com.embedcache.repository;

import com.embedcache.model.CacheKey;

import java.util.Optional;

/**
 * Byte-level storage behind the embeddings cache.
 * Implementations can be local (in-process map) or remote (Redis).
 */
public interface CacheStore {

    /**
     * Get the blob stored under a key.
     *
     * @param key cache key
     * @return stored bytes, or empty if nothing was written under the key
     * @throws CacheBackendException if the backend cannot be reached
     * @throws CacheTimeoutException if the backend did not answer within the configured wait
     */
    Optional<byte[]> get(CacheKey key);

    /**
     * Store a blob, replacing any previous value under the same key.
     *
     * @param key   cache key
     * @param value encoded vector
     * @throws CacheBackendException if the backend cannot be reached
     * @throws CacheTimeoutException if the backend did not answer within the configured wait
     */
    void set(CacheKey key, byte[] value);
}
