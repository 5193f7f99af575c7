package com.embedcache.service;

import com.embedcache.config.EmbedCacheProperties;
import com.embedcache.model.CacheKey;
import com.embedcache.model.dto.CacheStatistics;
import com.embedcache.repository.CacheBackendException;
import com.embedcache.repository.CacheStore;
import com.embedcache.repository.CacheTimeoutException;
import com.embedcache.repository.InMemoryCacheStore;
import com.embedcache.repository.converter.VectorConverter;
import com.embedcache.repository.converter.VectorDecodeException;
import com.embedcache.service.canonicalization.CacheKeyDeriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Embeddings cache: text to vector, keyed by content hash.
 *
 * Flow:
 * 1. Derive the SHA-256 key of the text
 * 2. Read or write the encoded vector through the configured {@link CacheStore}
 * 3. Convert every backend or decode failure into a miss (lookup) or a no-op (update)
 *
 * This is the only place cache failures are recovered; nothing thrown by the store
 * reaches the embedding caller. Keys do not include the model, so one instance must
 * only ever hold vectors from a single embedding model.
 */
@Slf4j
@Service
public class EmbeddingsCache {

    private final CacheKeyDeriver keyDeriver;
    private final CacheStore store;
    private final VectorConverter converter;
    private final EmbedCacheProperties properties;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong backendErrors = new AtomicLong();
    private final AtomicLong lookupErrors = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    public EmbeddingsCache(
            CacheKeyDeriver keyDeriver,
            CacheStore store,
            VectorConverter converter,
            EmbedCacheProperties properties) {
        this.keyDeriver = keyDeriver;
        this.store = store;
        this.converter = converter;
        this.properties = properties;
        log.info("Embeddings cache ready: backend={}, enabled={}",
                properties.getCache().getBackend(), properties.getCache().isEnabled());
    }

    /**
     * Look up the cached vector for a text.
     *
     * @param text input text
     * @return cached vector, or empty on miss, backend failure or unreadable entry
     */
    public Optional<float[]> lookup(String text) {
        Objects.requireNonNull(text, "text");
        if (!properties.getCache().isEnabled()) {
            return Optional.empty();
        }

        CacheKey key = keyDeriver.deriveKey(text);
        long startTime = System.nanoTime();

        try {
            Optional<byte[]> stored = store.get(key);
            if (stored.isEmpty()) {
                misses.incrementAndGet();
                log.debug("Cache MISS: key={}", key);
                return Optional.empty();
            }

            float[] vector = converter.decode(stored.get());
            hits.incrementAndGet();

            long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
            log.debug("Cache HIT in {}ms: key={}, dimensions={}", latencyMs, key, vector.length);
            return Optional.of(vector);

        } catch (CacheTimeoutException e) {
            backendErrors.incrementAndGet();
            lookupErrors.incrementAndGet();
            log.warn("Cache lookup timed out after {}, treating as miss: key={}", e.getTimeout(), key);
            return Optional.empty();
        } catch (CacheBackendException e) {
            backendErrors.incrementAndGet();
            lookupErrors.incrementAndGet();
            log.warn("Cache backend unavailable on lookup, treating as miss: key={}", key, e);
            return Optional.empty();
        } catch (VectorDecodeException e) {
            decodeErrors.incrementAndGet();
            log.warn("Discarding unreadable cache entry: key={}, reason={}", key, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            backendErrors.incrementAndGet();
            lookupErrors.incrementAndGet();
            log.error("Unexpected cache store failure on lookup, treating as miss: key={}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Store the vector computed for a text. Failures are logged, never thrown.
     *
     * @param text   input text
     * @param vector embedding computed for the text
     */
    public void update(String text, float[] vector) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(vector, "vector");
        if (!properties.getCache().isEnabled()) {
            return;
        }

        CacheKey key = keyDeriver.deriveKey(text);

        try {
            store.set(key, converter.encode(vector));
            writes.incrementAndGet();
            log.debug("Stored in cache: key={}, dimensions={}", key, vector.length);

        } catch (CacheTimeoutException e) {
            writeFailures.incrementAndGet();
            backendErrors.incrementAndGet();
            log.warn("Cache update timed out after {}, skipped: key={}", e.getTimeout(), key);
        } catch (CacheBackendException e) {
            writeFailures.incrementAndGet();
            backendErrors.incrementAndGet();
            log.warn("Cache backend unavailable on update, skipped: key={}", key, e);
        } catch (RuntimeException e) {
            writeFailures.incrementAndGet();
            backendErrors.incrementAndGet();
            log.error("Unexpected cache store failure on update, skipped: key={}", key, e);
        }
    }

    public CacheStatistics getStats() {
        long hitCount = hits.get();
        long lookups = hitCount + misses.get() + decodeErrors.get() + lookupErrors.get();

        return CacheStatistics.builder()
                .backend(properties.getCache().getBackend().name().toLowerCase(Locale.ROOT))
                .enabled(properties.getCache().isEnabled())
                .hits(hitCount)
                .misses(misses.get())
                .backendErrors(backendErrors.get())
                .lookupErrors(lookupErrors.get())
                .decodeErrors(decodeErrors.get())
                .writes(writes.get())
                .writeFailures(writeFailures.get())
                .hitRate(lookups > 0 ? (double) hitCount / lookups : 0.0)
                .entries(store instanceof InMemoryCacheStore ? ((InMemoryCacheStore) store).size() : -1)
                .build();
    }
}
