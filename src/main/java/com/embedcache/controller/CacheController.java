package com.embedcache.controller;

import com.embedcache.model.dto.CacheStatistics;
import com.embedcache.service.EmbeddingsCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the embeddings cache counters.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final EmbeddingsCache embeddingsCache;

    public CacheController(EmbeddingsCache embeddingsCache) {
        this.embeddingsCache = embeddingsCache;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        CacheStatistics stats = embeddingsCache.getStats();
        log.debug("Cache stats requested: hits={}, misses={}", stats.getHits(), stats.getMisses());
        return ResponseEntity.ok(stats);
    }
}
