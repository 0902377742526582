package com.sqlrecall.repository;

import com.sqlrecall.entity.QueryCacheEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for query cache entries.
 */
@Repository
public interface QueryCacheEntryRepository extends JpaRepository<QueryCacheEntryEntity, String> {

    /**
     * Find a usable entry by key. Soft-invalidated rows are never returned.
     */
    Optional<QueryCacheEntryEntity> findByCacheKeyAndValidTrue(String cacheKey);

    /**
     * LRU scan over valid entries, loading only key and size.
     * Ties on last access are broken by creation time, then key.
     */
    List<EvictionCandidate> findByValidTrueOrderByLastAccessedAtAscCreatedAtAscCacheKeyAsc();

    /**
     * Answers of all valid entries, for the error-signature sweep.
     */
    List<AnswerView> findAnswerViewsByValidTrue();

    long countByValidTrue();

    @Query("SELECT COALESCE(SUM(e.sizeBytes), 0) FROM QueryCacheEntryEntity e WHERE e.valid = true")
    long sumValidSizeBytes();

    @Query("SELECT COALESCE(SUM(e.sizeBytes), 0) FROM QueryCacheEntryEntity e")
    long sumSizeBytes();

    @Query("SELECT COALESCE(SUM(e.accessCount), 0) FROM QueryCacheEntryEntity e WHERE e.valid = true")
    long sumValidAccessCount();

    @Query("SELECT COALESCE(AVG(e.executionTimeMs), 0.0) FROM QueryCacheEntryEntity e WHERE e.valid = true")
    double avgValidExecutionTimeMs();

    /**
     * Batch hard delete by key.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueryCacheEntryEntity e WHERE e.cacheKey IN :keys")
    int deleteEntries(@Param("keys") Collection<String> keys);

    /**
     * Delete every entry whose expiry lies before the given instant, valid or not.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueryCacheEntryEntity e WHERE e.expiresAt < :now")
    int deleteExpiredEntries(@Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueryCacheEntryEntity e WHERE e.valid = false")
    int deleteInvalidEntries();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE QueryCacheEntryEntity e
            SET e.valid = false, e.invalidationReason = :reason
            WHERE e.cacheKey IN :keys AND e.valid = true
            """)
    int markInvalid(@Param("keys") Collection<String> keys, @Param("reason") String reason);

    /**
     * Key and size of an entry, ordered for eviction.
     */
    interface EvictionCandidate {
        String getCacheKey();

        long getSizeBytes();
    }

    interface AnswerView {
        String getCacheKey();

        String getOriginalQuestion();

        String getAnswer();
    }
}
