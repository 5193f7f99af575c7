package com.embedcache.repository.converter;

/**
 * Thrown when a stored blob is not a valid encoded vector (corrupt or written by another format version).
 */
public class VectorDecodeException extends RuntimeException {

    public VectorDecodeException(String message) {
        super(message);
    }
}
