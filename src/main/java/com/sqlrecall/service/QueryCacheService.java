package com.sqlrecall.service;

import com.sqlrecall.config.SqlRecallProperties;
import com.sqlrecall.entity.DailyStatisticEntity;
import com.sqlrecall.entity.QueryCacheEntryEntity;
import com.sqlrecall.model.CacheLookup;
import com.sqlrecall.model.CachedQueryResult;
import com.sqlrecall.model.ResultTable;
import com.sqlrecall.model.dto.CacheStatistics;
import com.sqlrecall.model.dto.DailyStatisticSummary;
import com.sqlrecall.repository.QueryCacheEntryRepository.AnswerView;
import com.sqlrecall.service.codec.CachePayloadException;
import com.sqlrecall.service.codec.ResultTableCodec;
import com.sqlrecall.service.guard.AnswerErrorGuard;
import com.sqlrecall.service.keys.QuestionKeyGenerator;
import com.sqlrecall.service.keys.QuestionKeyGenerator.CacheKey;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Query-result cache for natural-language SQL questions.
 *
 * Read path: normalize -> lookup -> expiry/guard check -> statistics.
 * Write path: error guard -> size check -> LRU eviction -> upsert.
 *
 * Every operation runs under one lock and one transaction. Storage failures never
 * escape: reads degrade to a miss, writes report {@code false}, purges report 0.
 */
@Slf4j
@Service
public class QueryCacheService {

    private final QueryCacheStore store;
    private final QuestionKeyGenerator keyGenerator;
    private final ResultTableCodec codec;
    private final AnswerErrorGuard errorGuard;
    private final CacheEvictionPolicy evictionPolicy;
    private final CacheStatisticsTracker statisticsTracker;
    private final SqlRecallProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean available;

    public QueryCacheService(
            QueryCacheStore store,
            QuestionKeyGenerator keyGenerator,
            ResultTableCodec codec,
            AnswerErrorGuard errorGuard,
            CacheEvictionPolicy evictionPolicy,
            CacheStatisticsTracker statisticsTracker,
            SqlRecallProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.codec = codec;
        this.errorGuard = errorGuard;
        this.evictionPolicy = evictionPolicy;
        this.statisticsTracker = statisticsTracker;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @PostConstruct
    void initialize() {
        if (!properties.getCache().isEnabled()) {
            available = false;
            log.info("Query cache disabled by configuration");
            return;
        }
        try {
            long entries = store.probe();
            available = true;
            log.info("Query cache initialized ({} stored entries, cap {} MB)",
                    entries, properties.getCache().getMaxSizeBytes() / 1024 / 1024);
        } catch (Exception e) {
            available = false;
            log.error("Failed to initialize query cache store, continuing without cache", e);
        }
    }

    public boolean isAvailable() {
        return available;
    }

    public void requireAvailable() {
        if (!available) {
            throw new CacheUnavailableException("Query cache is unavailable");
        }
    }

    /**
     * Retrieve the cached result for a question.
     *
     * @param question  user's natural language question
     * @param modelName model the answer was generated with
     * @return tagged lookup; only a HIT carries a result
     */
    public CacheLookup get(String question, String modelName) {
        if (!available) {
            return CacheLookup.unavailable();
        }

        CacheKey key = keyGenerator.generate(question, modelName);
        try {
            return locked(() -> transactionTemplate.execute(status -> lookup(key, question)));
        } catch (Exception e) {
            log.error("Cache retrieval error for key: {}", key.abbreviated(), e);
            return CacheLookup.miss(key.value());
        }
    }

    private CacheLookup lookup(CacheKey key, String question) {
        Instant now = clock.instant();
        Optional<QueryCacheEntryEntity> found = store.find(key.value());

        if (found.isEmpty()) {
            log.info("Cache MISS for key: {}", key.abbreviated());
            statisticsTracker.recordMiss();
            return CacheLookup.miss(key.value());
        }

        QueryCacheEntryEntity entry = found.get();
        if (!entry.isValid()) {
            log.info("Cache INVALID ({}) for key: {}", entry.getInvalidationReason(), key.abbreviated());
            statisticsTracker.recordMiss();
            return CacheLookup.invalid(key.value());
        }

        if (entry.isExpiredAt(now)) {
            log.info("Cache EXPIRED for key: {}", key.abbreviated());
            store.markInvalid(entry, QueryCacheEntryEntity.REASON_TTL_EXPIRED);
            statisticsTracker.recordMiss();
            return CacheLookup.expired(key.value());
        }

        if (errorGuard.looksLikeFailure(entry.getAnswer())) {
            log.warn("Cached answer contains an error, invalidating key: {}", key.abbreviated());
            store.markInvalid(entry, QueryCacheEntryEntity.REASON_ERROR_SIGNATURE);
            statisticsTracker.recordMiss();
            return CacheLookup.invalid(key.value());
        }

        ResultTable table;
        List<String> columns;
        try {
            table = entry.getResultPayload() != null ? codec.decode(entry.getResultPayload()) : null;
            columns = codec.decodeColumns(entry.getColumnManifest());
        } catch (CachePayloadException e) {
            log.error("Failed to deserialize cached data for key: {}", key.abbreviated(), e);
            store.markInvalid(entry, QueryCacheEntryEntity.REASON_CORRUPT_PAYLOAD);
            statisticsTracker.recordMiss();
            return CacheLookup.miss(key.value());
        }

        store.recordAccess(entry, now);
        statisticsTracker.recordHit();
        log.info("Cache HIT for key: {}", key.abbreviated());

        return CacheLookup.hit(key.value(), CachedQueryResult.builder()
                .question(question)
                .sqlQuery(entry.getSqlQuery())
                .answer(entry.getAnswer())
                .table(table)
                .metadata(CachedQueryResult.CacheMetadata.builder()
                        .cacheKey(entry.getCacheKey())
                        .modelName(entry.getModelName())
                        .originalQuestion(entry.getOriginalQuestion())
                        .createdAt(entry.getCreatedAt())
                        .expiresAt(entry.getExpiresAt())
                        .rowCount(entry.getRowCount())
                        .columns(columns)
                        .accessCount(entry.getAccessCount())
                        .sizeBytes(entry.getSizeBytes())
                        .executionTimeMs(entry.getExecutionTimeMs())
                        .build())
                .build());
    }

    /**
     * Store a query result with the default TTL.
     */
    public boolean set(String question, String modelName, String sqlQuery, String answer,
                       ResultTable table, double executionTimeMs) {
        return set(question, modelName, sqlQuery, answer, table, executionTimeMs, null);
    }

    /**
     * Store a query result.
     *
     * @param ttlSeconds time-to-live override, null for the configured default
     * @return true if cached; false if rejected (error answer, too large) or the store failed
     */
    public boolean set(String question, String modelName, String sqlQuery, String answer,
                       ResultTable table, double executionTimeMs, Long ttlSeconds) {
        if (!available) {
            return false;
        }

        Optional<String> rejection = errorGuard.rejectionReason(answer);
        if (rejection.isPresent()) {
            log.warn("Skipping cache for {} response: {}", rejection.get(), abbreviate(answer, 100));
            return false;
        }

        long ttl = ttlSeconds != null ? ttlSeconds : properties.getCache().getDefaultTtl().toSeconds();
        if (ttl < 0) {
            log.warn("Refusing to cache with negative TTL {}s", ttl);
            return false;
        }

        CacheKey key = keyGenerator.generate(question, modelName);

        byte[] payload = null;
        int rowCount = 0;
        String columnManifest = null;
        if (table != null && !table.isEmpty()) {
            try {
                payload = codec.encode(table);
                columnManifest = codec.encodeColumns(table.getColumns());
                rowCount = table.getRowCount();
            } catch (CachePayloadException e) {
                log.error("Failed to serialize result table for key: {}", key.abbreviated(), e);
                return false;
            }
        }

        long sizeBytes = (payload != null ? payload.length : 0) + utf8Length(answer) + utf8Length(sqlQuery);
        if (evictionPolicy.exceedsEntryLimit(sizeBytes)) {
            log.warn("Entry size ({} KB) exceeds limit ({} KB). Not caching.",
                    sizeBytes / 1024, evictionPolicy.entryLimit() / 1024);
            return false;
        }

        QueryCacheEntryEntity entry = QueryCacheEntryEntity.builder()
                .cacheKey(key.value())
                .normalizedQuestion(key.normalizedQuestion())
                .originalQuestion(question == null ? "" : question)
                .modelName(modelName == null ? "" : modelName)
                .sqlQuery(sqlQuery)
                .answer(answer)
                .resultPayload(payload)
                .rowCount(rowCount)
                .columnManifest(columnManifest)
                .ttlSeconds(ttl)
                .sizeBytes(sizeBytes)
                .executionTimeMs(executionTimeMs)
                .build();

        try {
            locked(() -> transactionTemplate.execute(status -> {
                evictionPolicy.ensureCapacity(key.value(), sizeBytes);
                return store.upsert(entry, clock.instant());
            }));
            log.info("Cached result for key: {} (size: {} KB, rows: {})", key.abbreviated(), sizeBytes / 1024, rowCount);
            return true;
        } catch (Exception e) {
            log.error("Failed to cache result for key: {}", key.abbreviated(), e);
            return false;
        }
    }

    /**
     * Remove every cache entry.
     */
    public int clearAll() {
        if (!available) {
            return 0;
        }
        try {
            int count = locked(() -> transactionTemplate.execute(status -> store.deleteAll()));
            log.info("Cleared {} cache entries", count);
            return count;
        } catch (Exception e) {
            log.error("Failed to clear cache", e);
            return 0;
        }
    }

    /**
     * Hard-delete every entry whose TTL has elapsed.
     */
    public int clearExpired() {
        if (!available) {
            return 0;
        }
        try {
            int count = locked(() -> transactionTemplate.execute(status -> store.deleteExpired(clock.instant())));
            log.info("Removed {} expired cache entries", count);
            return count;
        } catch (Exception e) {
            log.error("Failed to clear expired entries", e);
            return 0;
        }
    }

    /**
     * Hard-delete every soft-invalidated entry.
     */
    public int purgeInvalid() {
        if (!available) {
            return 0;
        }
        try {
            int count = locked(() -> transactionTemplate.execute(status -> store.deleteInvalid()));
            log.info("Removed {} invalid cache entries", count);
            return count;
        } catch (Exception e) {
            log.error("Failed to purge invalid entries", e);
            return 0;
        }
    }

    /**
     * Soft-invalidate valid entries whose answer looks like a failed execution
     * or a placeholder stored for a chart/report question.
     *
     * @return number of entries invalidated
     */
    public int invalidateFailedAnswers() {
        if (!available) {
            return 0;
        }
        try {
            int count = locked(() -> transactionTemplate.execute(status -> sweepAnswers()));
            if (count > 0) {
                log.info("Invalidated {} cached error or placeholder answer(s)", count);
            }
            return count;
        } catch (Exception e) {
            log.error("Failed to sweep cached answers", e);
            return 0;
        }
    }

    private int sweepAnswers() {
        Map<String, List<String>> keysByReason = new HashMap<>();
        for (AnswerView view : store.validAnswers()) {
            errorGuard.sweepReason(view.getOriginalQuestion(), view.getAnswer())
                    .ifPresent(reason -> keysByReason.computeIfAbsent(reason, r -> new ArrayList<>())
                            .add(view.getCacheKey()));
        }
        int invalidated = 0;
        for (Map.Entry<String, List<String>> group : keysByReason.entrySet()) {
            invalidated += store.markInvalid(group.getValue(), group.getKey());
        }
        return invalidated;
    }

    /**
     * Get cache performance statistics: all-time aggregates over valid entries plus today's counters.
     */
    public CacheStatistics getStatistics() {
        if (!available) {
            return CacheStatistics.empty(statisticsTracker.today());
        }
        try {
            return locked(() -> transactionTemplate.execute(status -> buildStatistics()));
        } catch (Exception e) {
            log.error("Failed to get statistics", e);
            return CacheStatistics.empty(statisticsTracker.today());
        }
    }

    private CacheStatistics buildStatistics() {
        long totalSize = store.aggregateSize(true);
        Optional<DailyStatisticEntity> today = statisticsTracker.forToday();

        return CacheStatistics.builder()
                .totalEntries(store.countValid())
                .totalSizeBytes(totalSize)
                .totalSizeMb(totalSize / 1024.0 / 1024.0)
                .totalAccesses(store.sumValidAccessCount())
                .avgExecutionTimeMs(store.avgValidExecutionTimeMs())
                .date(statisticsTracker.today())
                .todayHits(today.map(DailyStatisticEntity::getHits).orElse(0L))
                .todayMisses(today.map(DailyStatisticEntity::getMisses).orElse(0L))
                .todayTotal(today.map(DailyStatisticEntity::getTotalQueries).orElse(0L))
                .todayHitRate(today.map(DailyStatisticEntity::getHitRate).orElse(0.0))
                .apiCallsSaved(today.map(DailyStatisticEntity::getApiCallsSaved).orElse(0L))
                .build();
    }

    /**
     * Daily counters for the last {@code days} days, newest first.
     */
    public List<DailyStatisticSummary> getDailyHistory(int days) {
        if (!available || days < 1) {
            return List.of();
        }
        try {
            return locked(() -> transactionTemplate.execute(status -> statisticsTracker.history(days).stream()
                    .map(DailyStatisticSummary::from)
                    .collect(Collectors.toList())));
        } catch (Exception e) {
            log.error("Failed to get daily statistics", e);
            return List.of();
        }
    }

    private <T> T locked(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    private static long utf8Length(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String abbreviate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
