package com.soundledger.data.adapter.driven.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RevenueRecordJpaRepository extends JpaRepository<RevenueRecordEntity, Long> {
    List<RevenueRecordEntity> findByPeriodYearAndPeriodQuarterOrderByIdAsc(int periodYear, int periodQuarter);
}
