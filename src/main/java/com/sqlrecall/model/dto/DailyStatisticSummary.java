package com.sqlrecall.model.dto;

import com.sqlrecall.entity.DailyStatisticEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Hit/miss counters of a single day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStatisticSummary {
    private LocalDate date;
    private long hits;
    private long misses;
    private long totalQueries;
    private double hitRate;
    private long apiCallsSaved;

    public static DailyStatisticSummary from(DailyStatisticEntity entity) {
        return DailyStatisticSummary.builder()
                .date(entity.getStatDate())
                .hits(entity.getHits())
                .misses(entity.getMisses())
                .totalQueries(entity.getTotalQueries())
                .hitRate(entity.getHitRate())
                .apiCallsSaved(entity.getApiCallsSaved())
                .build();
    }
}
