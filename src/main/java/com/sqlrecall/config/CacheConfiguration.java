package com.sqlrecall.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time source for TTL, LRU bookkeeping and daily statistics.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final SqlRecallProperties properties;

    public CacheConfiguration(SqlRecallProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock cacheClock() {
        String zone = properties.getCache().getZone();
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("Query cache clock using zone {}", zoneId);
        return Clock.system(zoneId);
    }
}
