package com.sqlrecall.repository;

import com.sqlrecall.entity.DailyStatisticEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for per-day cache hit/miss counters.
 */
@Repository
public interface DailyStatisticRepository extends JpaRepository<DailyStatisticEntity, LocalDate> {

    List<DailyStatisticEntity> findByStatDateGreaterThanEqualOrderByStatDateDesc(LocalDate from);
}
