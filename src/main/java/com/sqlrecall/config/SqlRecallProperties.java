package com.sqlrecall.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for SQL Recall.
 */
@Data
@Component
@ConfigurationProperties(prefix = "sqlrecall")
public class SqlRecallProperties {

    /**
     * Failure markers checked against answers before they are cached.
     * Matched case-insensitively, anywhere in the answer unless anchored.
     */
    public static final List<String> DEFAULT_ERROR_SIGNATURES = List.of(
            "^\\s*error\\b",
            "error code:",
            "\\b(?:http|status)(?:\\s+code)?\\s*:?\\s*[45]\\d{2}\\b",
            "\\b(?:402|404)\\b[^\\n]{0,40}\\b(?:payment required|not found)\\b"
    );

    private CacheConfig cache = new CacheConfig();
    private WarmingConfig warming = new WarmingConfig();

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofHours(24);
        private long maxSizeBytes = 500L * 1024 * 1024;
        private long maxEntrySizeBytes = 10L * 1024 * 1024;

        /**
         * Fraction of the aggregate cap to shrink to once eviction kicks in.
         */
        private double evictionTargetRatio = 0.9;

        /**
         * Zone used to roll daily statistics over. Defaults to the system zone.
         */
        private String zone;

        private List<String> errorSignatures = new ArrayList<>(DEFAULT_ERROR_SIGNATURES);
        private MaintenanceConfig maintenance = new MaintenanceConfig();
    }

    @Data
    public static class MaintenanceConfig {
        private boolean enabled = true;
        private boolean runOnStartup = true;
        private Duration interval = Duration.ofHours(1);
    }

    @Data
    public static class WarmingConfig {
        private boolean enabled = false;
        private String model;
        private Integer maxQuestions;
        private List<String> questions = new ArrayList<>();
    }
}
