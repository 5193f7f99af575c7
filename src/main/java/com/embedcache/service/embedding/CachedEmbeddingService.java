package com.embedcache.service.embedding;

import com.embedcache.service.EmbeddingsCache;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Embedding service decorator that consults the cache before calling the model.
 *
 * Single text: lookup, on miss compute and update.
 * Batch: lookup every text, send only the distinct misses to the model in one batch call,
 * then update the cache with each computed vector.
 *
 * Built by the host around its own model; the cache passed in must not be shared with
 * another model since cache keys carry no model identifier.
 */
@Slf4j
public class CachedEmbeddingService implements EmbeddingService {

    private final EmbeddingService delegate;
    private final EmbeddingsCache cache;

    public CachedEmbeddingService(EmbeddingService delegate, EmbeddingsCache cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        log.info("Caching embeddings for model {}", delegate.modelName());
    }

    @Override
    public float[] embed(String text) {
        Optional<float[]> cached = cache.lookup(text);
        if (cached.isPresent()) {
            return cached.get();
        }

        float[] vector = delegate.embed(text);
        cache.update(text, vector);
        return vector;
    }

    @Override
    public float[][] embedBatch(String[] texts) {
        float[][] embeddings = new float[texts.length][];
        if (texts.length == 0) {
            return embeddings;
        }

        // distinct missing texts -> positions in the input that need them
        Map<String, List<Integer>> missing = new LinkedHashMap<>();
        for (int i = 0; i < texts.length; i++) {
            Optional<float[]> cached = cache.lookup(texts[i]);
            if (cached.isPresent()) {
                embeddings[i] = cached.get();
            } else {
                missing.computeIfAbsent(texts[i], t -> new ArrayList<>()).add(i);
            }
        }

        if (missing.isEmpty()) {
            log.debug("Batch of {} served entirely from cache", texts.length);
            return embeddings;
        }

        String[] toCompute = missing.keySet().toArray(new String[0]);
        float[][] computed = delegate.embedBatch(toCompute);
        if (computed.length != toCompute.length) {
            throw new IllegalStateException("Model " + delegate.modelName() + " returned "
                    + computed.length + " vectors for " + toCompute.length + " texts");
        }

        for (int j = 0; j < toCompute.length; j++) {
            cache.update(toCompute[j], computed[j]);
            List<Integer> positions = missing.get(toCompute[j]);
            embeddings[positions.get(0)] = computed[j];
            // repeated texts get their own copy
            for (int k = 1; k < positions.size(); k++) {
                embeddings[positions.get(k)] = computed[j].clone();
            }
        }

        log.debug("Batch of {}: {} from cache, {} computed",
                texts.length, texts.length - countPositions(missing), toCompute.length);
        return embeddings;
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    @Override
    public boolean isReady() {
        return delegate.isReady();
    }

    private static int countPositions(Map<String, List<Integer>> missing) {
        return missing.values().stream().mapToInt(List::size).sum();
    }
}
