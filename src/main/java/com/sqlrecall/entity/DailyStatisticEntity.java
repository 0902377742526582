package com.sqlrecall.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA entity for cache_daily_statistics: one row of hit/miss counters per calendar day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "cache_daily_statistics")
public class DailyStatisticEntity {

    @Id
    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Column(name = "hits", nullable = false)
    private long hits;

    @Column(name = "misses", nullable = false)
    private long misses;

    @Column(name = "total_queries", nullable = false)
    private long totalQueries;

    @Column(name = "hit_rate", nullable = false)
    private double hitRate;

    @Column(name = "api_calls_saved", nullable = false)
    private long apiCallsSaved;

    public static DailyStatisticEntity startingOn(LocalDate date) {
        return DailyStatisticEntity.builder()
                .statDate(date)
                .build();
    }

    public void recordHit() {
        hits++;
        recompute();
    }

    public void recordMiss() {
        misses++;
        recompute();
    }

    private void recompute() {
        totalQueries = hits + misses;
        hitRate = totalQueries > 0 ? (double) hits / totalQueries : 0.0;
        apiCallsSaved = hits;
    }
}
