package com.sqlrecall.service;

import com.sqlrecall.config.SqlRecallProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the maintenance sweep once the application is ready and then on a fixed delay.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sqlrecall.cache.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheMaintenanceScheduler {

    private final CacheMaintenanceService maintenanceService;
    private final QueryCacheService cacheService;
    private final SqlRecallProperties properties;

    public CacheMaintenanceScheduler(CacheMaintenanceService maintenanceService,
                                     QueryCacheService cacheService,
                                     SqlRecallProperties properties) {
        this.maintenanceService = maintenanceService;
        this.cacheService = cacheService;
        this.properties = properties;
    }

    /**
     * Clears cached errors before anything else (warming included) reads the cache.
     */
    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getCache().getMaintenance().isRunOnStartup()) {
            log.info("Clearing cached errors and expired entries on startup...");
            sweep();
        }
    }

    @Scheduled(initialDelayString = "${sqlrecall.cache.maintenance.interval:PT1H}",
            fixedDelayString = "${sqlrecall.cache.maintenance.interval:PT1H}")
    public void scheduledSweep() {
        sweep();
    }

    private void sweep() {
        if (!cacheService.isAvailable()) {
            log.debug("Query cache unavailable, skipping maintenance");
            return;
        }
        maintenanceService.runMaintenance();
    }
}
