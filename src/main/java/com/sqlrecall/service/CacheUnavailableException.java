package com.sqlrecall.service;

/**
 * Thrown by {@link QueryCacheService#requireAvailable()} when the cache is disabled or its store failed to start.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }
}
