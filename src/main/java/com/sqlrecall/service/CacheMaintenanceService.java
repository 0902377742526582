package com.sqlrecall.service;

import com.sqlrecall.model.dto.MaintenanceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maintenance sweep: invalidate error answers, then reclaim expired and invalid rows.
 */
@Slf4j
@Service
public class CacheMaintenanceService {

    private final QueryCacheService cacheService;

    public CacheMaintenanceService(QueryCacheService cacheService) {
        this.cacheService = cacheService;
    }

    public MaintenanceReport runMaintenance() {
        long start = System.nanoTime();

        int invalidated = cacheService.invalidateFailedAnswers();
        int expiredRemoved = cacheService.clearExpired();
        int invalidRemoved = cacheService.purgeInvalid();

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.info("Cache maintenance finished in {}ms: invalidated={}, expiredRemoved={}, invalidRemoved={}",
                durationMs, invalidated, expiredRemoved, invalidRemoved);

        return MaintenanceReport.builder()
                .invalidated(invalidated)
                .expiredRemoved(expiredRemoved)
                .invalidRemoved(invalidRemoved)
                .durationMs(durationMs)
                .build();
    }
}
