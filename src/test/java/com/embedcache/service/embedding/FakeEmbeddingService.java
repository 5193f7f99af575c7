package com.embedcache.service.embedding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embedding model for tests: nine 1.0 components followed by the text's index in its batch.
 * Records every text it was asked to embed.
 */
class FakeEmbeddingService implements EmbeddingService {

    static final int DIMENSIONS = 10;

    final List<String> embedded = new ArrayList<>();
    final AtomicInteger batchCalls = new AtomicInteger();

    @Override
    public synchronized float[] embed(String text) {
        embedded.add(text);
        return vector(0);
    }

    @Override
    public synchronized float[][] embedBatch(String[] texts) {
        batchCalls.incrementAndGet();
        float[][] vectors = new float[texts.length][];
        for (int i = 0; i < texts.length; i++) {
            embedded.add(texts[i]);
            vectors[i] = vector(i);
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return DIMENSIONS;
    }

    @Override
    public String modelName() {
        return "fake-embeddings";
    }

    @Override
    public boolean isReady() {
        return true;
    }

    static float[] vector(int index) {
        float[] vector = new float[DIMENSIONS];
        Arrays.fill(vector, 1.0f);
        vector[DIMENSIONS - 1] = index;
        return vector;
    }
}
