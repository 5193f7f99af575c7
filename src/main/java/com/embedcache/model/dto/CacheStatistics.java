package com.embedcache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters describing how the embeddings cache has served lookups and updates since startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Backend in use (memory, redis).
     */
    private String backend;

    private boolean enabled;

    /**
     * Lookups answered from the cache.
     */
    private long hits;

    /**
     * Lookups with no stored entry.
     */
    private long misses;

    /**
     * Lookups and updates that failed because the backend was unavailable or timed out.
     */
    private long backendErrors;

    /**
     * Lookups answered as misses because the backend failed or timed out.
     */
    private long lookupErrors;

    /**
     * Stored blobs that could not be decoded and were reported as misses.
     */
    private long decodeErrors;

    private long writes;

    private long writeFailures;

    /**
     * Hits over all lookups (0.0-1.0).
     */
    private double hitRate;

    /**
     * Stored entries, or -1 when the backend does not report a count.
     */
    private long entries;
}
