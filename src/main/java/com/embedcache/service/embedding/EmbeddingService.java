package com.embedcache.service.embedding;

/**
 * Service for generating text embeddings.
 * Implementations wrap a concrete model (local runtime or remote endpoint) supplied by the host.
 */
public interface EmbeddingService {

    /**
     * Generate embedding vector for text.
     *
     * @param text input text
     * @return embedding vector
     */
    float[] embed(String text);

    /**
     * Generate embeddings for multiple texts (batch).
     *
     * @param texts input texts
     * @return one vector per text, in input order
     */
    float[][] embedBatch(String[] texts);

    /**
     * @return number of dimensions in output vector
     */
    int dimensions();

    /**
     * @return model name
     */
    String modelName();

    /**
     * @return true if ready to embed
     */
    boolean isReady();
}
