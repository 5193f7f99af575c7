package com.embedcache.repository;

import java.time.Duration;

/**
 * Thrown when a cache backend did not answer within the allotted wait.
 * A timeout counts as the backend being unavailable.
 */
public class CacheTimeoutException extends CacheBackendException {

    private final Duration timeout;

    public CacheTimeoutException(String message, Duration timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
