package com.embedcache.repository;

/**
 * Thrown when a cache backend cannot serve a request (connection refused, reset, server error).
 */
public class CacheBackendException extends RuntimeException {

    public CacheBackendException(String message) {
        super(message);
    }

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
