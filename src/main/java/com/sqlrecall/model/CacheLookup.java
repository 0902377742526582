package com.sqlrecall.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a cache read. Only {@link Outcome#HIT} carries a result.
 */
public final class CacheLookup {

    public enum Outcome {
        HIT,        // Valid, unexpired entry served
        MISS,       // No entry, or the entry could not be decoded
        EXPIRED,    // Entry outlived its TTL and was soft-invalidated on this read
        INVALID,    // Entry was already invalid, or failed the error guard on this read
        UNAVAILABLE // Cache disabled or the store could not be initialized
    }

    private static final CacheLookup UNAVAILABLE = new CacheLookup(Outcome.UNAVAILABLE, null, null);

    private final Outcome outcome;
    private final String cacheKey;
    private final CachedQueryResult result;

    private CacheLookup(Outcome outcome, String cacheKey, CachedQueryResult result) {
        this.outcome = outcome;
        this.cacheKey = cacheKey;
        this.result = result;
    }

    public static CacheLookup hit(String cacheKey, CachedQueryResult result) {
        return new CacheLookup(Outcome.HIT, cacheKey, Objects.requireNonNull(result, "result"));
    }

    public static CacheLookup miss(String cacheKey) {
        return new CacheLookup(Outcome.MISS, cacheKey, null);
    }

    public static CacheLookup expired(String cacheKey) {
        return new CacheLookup(Outcome.EXPIRED, cacheKey, null);
    }

    public static CacheLookup invalid(String cacheKey) {
        return new CacheLookup(Outcome.INVALID, cacheKey, null);
    }

    public static CacheLookup unavailable() {
        return UNAVAILABLE;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public boolean isHit() {
        return outcome == Outcome.HIT;
    }

    public Optional<CachedQueryResult> getResult() {
        return Optional.ofNullable(result);
    }

    @Override
    public String toString() {
        return "CacheLookup{outcome=" + outcome + ", cacheKey=" + cacheKey + "}";
    }
}
