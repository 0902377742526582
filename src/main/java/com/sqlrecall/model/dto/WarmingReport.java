package com.sqlrecall.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of pre-populating the cache with suggested questions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmingReport {
    private boolean success;

    /**
     * Why warming did not run, when {@code success} is false.
     */
    private String reason;

    private int cachedCount;
    private int skippedCount;
    private int rejectedCount;
    private int failedCount;
    private int totalQuestions;
    private double durationSeconds;

    public static WarmingReport notRun(String reason) {
        return WarmingReport.builder()
                .success(false)
                .reason(reason)
                .build();
    }
}
