package com.sqlrecall.service;

import com.sqlrecall.config.SqlRecallProperties;
import com.sqlrecall.entity.QueryCacheEntryEntity;
import com.sqlrecall.repository.QueryCacheEntryRepository.EvictionCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Size-bounded LRU eviction.
 *
 * Only valid entries count towards the aggregate cap; soft-invalidated rows wait for the
 * maintenance sweep. Once a write would push the total over the cap, least recently accessed
 * entries are removed until the total plus the incoming entry fits under
 * {@code cap * evictionTargetRatio}.
 */
@Slf4j
@Component
public class CacheEvictionPolicy {

    private final QueryCacheStore store;
    private final SqlRecallProperties properties;

    public CacheEvictionPolicy(QueryCacheStore store, SqlRecallProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Whether a single entry is too large to cache at all.
     * An entry larger than the aggregate cap could never fit either.
     */
    public boolean exceedsEntryLimit(long sizeBytes) {
        return sizeBytes > entryLimit();
    }

    public long entryLimit() {
        SqlRecallProperties.CacheConfig cache = properties.getCache();
        return Math.min(cache.getMaxEntrySizeBytes(), cache.getMaxSizeBytes());
    }

    /**
     * Make room for an entry of the given size about to be written under {@code incomingKey}.
     * The entry being replaced under the same key is neither counted nor evicted.
     *
     * @return number of entries evicted
     */
    public int ensureCapacity(String incomingKey, long incomingSize) {
        long cap = properties.getCache().getMaxSizeBytes();
        long current = store.aggregateSize(true) - store.get(incomingKey)
                .map(QueryCacheEntryEntity::getSizeBytes)
                .orElse(0L);

        if (current + incomingSize <= cap) {
            return 0;
        }

        double target = cap * properties.getCache().getEvictionTargetRatio();
        List<String> victims = new ArrayList<>();
        long freed = 0;

        for (EvictionCandidate candidate : store.scanByLastAccessAscending()) {
            if (current - freed + incomingSize <= target) {
                break;
            }
            if (candidate.getCacheKey().equals(incomingKey)) {
                continue;
            }
            victims.add(candidate.getCacheKey());
            freed += candidate.getSizeBytes();
        }

        int evicted = store.delete(victims);
        log.info("Evicted {} LRU entries ({} KB freed, cache at {} of {} bytes)",
                evicted, freed / 1024, current - freed, cap);
        return evicted;
    }
}
