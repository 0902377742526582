package com.sqlrecall.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts produced by one maintenance sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceReport {

    /**
     * Valid entries soft-invalidated because their answer looked like a failure.
     */
    private int invalidated;

    private int expiredRemoved;

    private int invalidRemoved;

    private long durationMs;
}
