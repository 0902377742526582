package com.sqlrecall.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * JPA entity for the query_cache_entries table.
 * One row per (normalized question, model) pair, keyed by its SHA-256 cache key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "query_cache_entries", indexes = {
        @Index(name = "idx_query_cache_expires_at", columnList = "expires_at"),
        @Index(name = "idx_query_cache_last_accessed_at", columnList = "last_accessed_at")
})
public class QueryCacheEntryEntity {

    public static final String REASON_TTL_EXPIRED = "ttl_expired";
    public static final String REASON_ERROR_SIGNATURE = "error_signature";
    public static final String REASON_BLANK_ANSWER = "blank_answer";
    public static final String REASON_PLACEHOLDER_ANSWER = "placeholder_answer";
    public static final String REASON_CORRUPT_PAYLOAD = "corrupt_payload";

    @Id
    @Column(name = "cache_key", nullable = false, length = 64)
    private String cacheKey;

    // Question
    @Lob
    @Column(name = "normalized_question", nullable = false)
    private String normalizedQuestion;

    @Lob
    @Column(name = "original_question", nullable = false)
    private String originalQuestion;

    @Lob
    @Column(name = "model_name", nullable = false)
    private String modelName;

    // Content
    @Lob
    @Column(name = "sql_query")
    private String sqlQuery;

    @Lob
    @Column(name = "answer", nullable = false)
    private String answer;

    @Lob
    @ToString.Exclude
    @Column(name = "result_payload")
    private byte[] resultPayload;

    @Column(name = "row_count")
    private int rowCount;

    @Lob
    @Column(name = "column_manifest")
    private String columnManifest;

    // Timestamps
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "ttl_seconds", nullable = false)
    private long ttlSeconds;

    // Stats
    @Column(name = "access_count", nullable = false)
    private long accessCount;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "execution_time_ms")
    private double executionTimeMs;

    // Flags
    @Builder.Default
    @Column(name = "is_valid", nullable = false)
    private boolean valid = true;

    @Column(name = "invalidation_reason", length = 32)
    private String invalidationReason;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        if (lastAccessedAt == null) {
            lastAccessedAt = createdAt;
        }
        if (createdAt != null) {
            expiresAt = createdAt.plusSeconds(ttlSeconds);
        }
    }

    /**
     * Stamp a fresh write: resets access bookkeeping and recomputes the expiry from the TTL.
     */
    public void stampWrite(Instant now) {
        this.createdAt = now;
        this.lastAccessedAt = now;
        this.expiresAt = now.plusSeconds(ttlSeconds);
        this.accessCount = 0;
        this.valid = true;
        this.invalidationReason = null;
    }

    /**
     * Check if this entry is expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Increment access count.
     */
    public void recordAccess(Instant now) {
        this.accessCount++;
        this.lastAccessedAt = now;
    }

    public void invalidate(String reason) {
        this.valid = false;
        this.invalidationReason = reason;
    }
}
