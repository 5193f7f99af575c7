package com.embedcache.repository;

import com.embedcache.model.CacheKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Process-local store backed by an unbounded Caffeine cache.
 *
 * No maximum size and no expiry: entries live until the process exits.
 * Values are copied on write and on read so a caller can never mutate stored bytes.
 */
@Slf4j
public class InMemoryCacheStore implements CacheStore {

    private final Cache<CacheKey, byte[]> entries;

    public InMemoryCacheStore() {
        this.entries = Caffeine.newBuilder().build();
        log.info("Initialized in-memory embedding cache store");
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        byte[] value = entries.getIfPresent(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(CacheKey key, byte[] value) {
        entries.put(key, value.clone());
    }

    /**
     * @return number of stored entries
     */
    public long size() {
        return entries.estimatedSize();
    }
}
