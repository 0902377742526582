package com.sqlrecall.service;

import com.sqlrecall.entity.DailyStatisticEntity;
import com.sqlrecall.repository.DailyStatisticRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Daily hit/miss counters. Hit rate and calls saved are recomputed on every update.
 */
@Component
public class CacheStatisticsTracker {

    private final DailyStatisticRepository repository;
    private final Clock clock;

    public CacheStatisticsTracker(DailyStatisticRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void recordHit() {
        DailyStatisticEntity stat = todayOrNew();
        stat.recordHit();
        repository.save(stat);
    }

    public void recordMiss() {
        DailyStatisticEntity stat = todayOrNew();
        stat.recordMiss();
        repository.save(stat);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public Optional<DailyStatisticEntity> forToday() {
        return repository.findById(today());
    }

    /**
     * Daily rows for the last {@code days} days including today, newest first.
     */
    public List<DailyStatisticEntity> history(int days) {
        return repository.findByStatDateGreaterThanEqualOrderByStatDateDesc(today().minusDays(days - 1L));
    }

    private DailyStatisticEntity todayOrNew() {
        LocalDate today = today();
        return repository.findById(today).orElseGet(() -> DailyStatisticEntity.startingOn(today));
    }
}
