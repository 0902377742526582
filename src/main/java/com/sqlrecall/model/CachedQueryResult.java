package com.sqlrecall.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A previously answered question served from the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedQueryResult {

    /**
     * The question as asked on this lookup (not necessarily the stored phrasing).
     */
    private String question;

    private String sqlQuery;

    private String answer;

    /**
     * Tabular result, or null when the entry was cached without one.
     */
    private ResultTable table;

    private CacheMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheMetadata {
        private String cacheKey;
        private String modelName;
        private String originalQuestion;
        private Instant createdAt;
        private Instant expiresAt;
        private int rowCount;
        private List<String> columns;
        private long accessCount;
        private long sizeBytes;
        private double executionTimeMs;
    }
}
