package com.sqlrecall.controller;

import com.sqlrecall.model.dto.CacheStatistics;
import com.sqlrecall.model.dto.DailyStatisticSummary;
import com.sqlrecall.model.dto.MaintenanceReport;
import com.sqlrecall.service.CacheMaintenanceService;
import com.sqlrecall.service.QueryCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics and manual purges for the query-result cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private static final int MAX_HISTORY_DAYS = 365;

    private final QueryCacheService cacheService;
    private final CacheMaintenanceService maintenanceService;

    public CacheController(QueryCacheService cacheService, CacheMaintenanceService maintenanceService) {
        this.cacheService = cacheService;
        this.maintenanceService = maintenanceService;
    }

    /**
     * Get cache statistics (all-time aggregates plus today's counters).
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cacheService.getStatistics());
    }

    /**
     * Get daily hit/miss counters, newest first.
     *
     * @param days number of days to include, clamped to 1..365
     */
    @GetMapping("/stats/daily")
    public ResponseEntity<List<DailyStatisticSummary>> getDailyStats(@RequestParam(defaultValue = "7") int days) {
        int clamped = Math.max(1, Math.min(days, MAX_HISTORY_DAYS));
        return ResponseEntity.ok(cacheService.getDailyHistory(clamped));
    }

    /**
     * Clear the whole cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        log.info("Cache clear requested");
        if (!cacheService.isAvailable()) {
            return unavailable();
        }
        int removed = cacheService.clearAll();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "removed", removed
        ));
    }

    /**
     * Remove expired entries.
     */
    @PostMapping("/clear-expired")
    public ResponseEntity<Map<String, Object>> clearExpired() {
        log.info("Expired cache purge requested");
        if (!cacheService.isAvailable()) {
            return unavailable();
        }
        int removed = cacheService.clearExpired();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "removed", removed
        ));
    }

    /**
     * Run the maintenance sweep now.
     */
    @PostMapping("/maintenance")
    public ResponseEntity<MaintenanceReport> runMaintenance() {
        log.info("Cache maintenance requested");
        if (!cacheService.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(maintenanceService.runMaintenance());
    }

    private ResponseEntity<Map<String, Object>> unavailable() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "status", "unavailable",
                "removed", 0
        ));
    }
}
