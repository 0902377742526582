package com.sqlrecall.service;

import com.sqlrecall.entity.QueryCacheEntryEntity;
import com.sqlrecall.repository.QueryCacheEntryRepository;
import com.sqlrecall.repository.QueryCacheEntryRepository.AnswerView;
import com.sqlrecall.repository.QueryCacheEntryRepository.EvictionCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store for cache entries (H2 through Spring Data JPA).
 * Callers run these operations inside the transaction opened by {@link QueryCacheService}.
 */
@Slf4j
@Component
public class QueryCacheStore {

    private final QueryCacheEntryRepository repository;

    public QueryCacheStore(QueryCacheEntryRepository repository) {
        this.repository = repository;
    }

    /**
     * Touch the underlying tables so initialization failures surface early.
     *
     * @return number of rows currently stored
     */
    public long probe() {
        return repository.count();
    }

    /**
     * Usable entry by key. Never returns a soft-invalidated row.
     */
    public Optional<QueryCacheEntryEntity> get(String cacheKey) {
        return repository.findByCacheKeyAndValidTrue(cacheKey);
    }

    /**
     * Entry by key regardless of validity.
     */
    public Optional<QueryCacheEntryEntity> find(String cacheKey) {
        return repository.findById(cacheKey);
    }

    /**
     * Insert or replace by cache key. The expiry is always recomputed from the TTL.
     */
    public QueryCacheEntryEntity upsert(QueryCacheEntryEntity entry, Instant now) {
        entry.stampWrite(now);
        return repository.save(entry);
    }

    public int delete(Collection<String> cacheKeys) {
        if (cacheKeys.isEmpty()) {
            return 0;
        }
        return repository.deleteEntries(cacheKeys);
    }

    /**
     * Valid entries as (key, size), least recently accessed first.
     */
    public List<EvictionCandidate> scanByLastAccessAscending() {
        return repository.findByValidTrueOrderByLastAccessedAtAscCreatedAtAscCacheKeyAsc();
    }

    public long aggregateSize(boolean validOnly) {
        return validOnly ? repository.sumValidSizeBytes() : repository.sumSizeBytes();
    }

    public void recordAccess(QueryCacheEntryEntity entry, Instant now) {
        entry.recordAccess(now);
        repository.save(entry);
    }

    public void markInvalid(QueryCacheEntryEntity entry, String reason) {
        entry.invalidate(reason);
        repository.save(entry);
        log.debug("Invalidated cache entry {} ({})", entry.getCacheKey(), reason);
    }

    public int markInvalid(Collection<String> cacheKeys, String reason) {
        if (cacheKeys.isEmpty()) {
            return 0;
        }
        return repository.markInvalid(cacheKeys, reason);
    }

    public List<AnswerView> validAnswers() {
        return repository.findAnswerViewsByValidTrue();
    }

    public int deleteExpired(Instant now) {
        return repository.deleteExpiredEntries(now);
    }

    public int deleteInvalid() {
        return repository.deleteInvalidEntries();
    }

    public int deleteAll() {
        int count = (int) repository.count();
        repository.deleteAllInBatch();
        return count;
    }

    public long countValid() {
        return repository.countByValidTrue();
    }

    public long sumValidAccessCount() {
        return repository.sumValidAccessCount();
    }

    public double avgValidExecutionTimeMs() {
        return repository.avgValidExecutionTimeMs();
    }
}
