package com.sqlrecall.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * All-time cache aggregates merged with today's hit/miss counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Number of valid cache entries.
     */
    private long totalEntries;

    /**
     * Summed size of valid entries.
     */
    private long totalSizeBytes;

    private double totalSizeMb;

    /**
     * Summed access count of valid entries.
     */
    private long totalAccesses;

    /**
     * Average execution time recorded with valid entries, in milliseconds.
     */
    private double avgExecutionTimeMs;

    /**
     * The day the "today" counters refer to.
     */
    private LocalDate date;

    private long todayHits;
    private long todayMisses;
    private long todayTotal;

    /**
     * Today's hit rate (0.0-1.0).
     */
    private double todayHitRate;

    /**
     * Language-model and database calls avoided today (one per hit).
     */
    private long apiCallsSaved;

    public static CacheStatistics empty(LocalDate date) {
        return CacheStatistics.builder()
                .date(date)
                .build();
    }
}
