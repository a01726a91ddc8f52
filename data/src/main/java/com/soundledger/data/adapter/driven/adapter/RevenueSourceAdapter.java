package com.soundledger.data.adapter.driven.adapter;

import com.soundledger.data.adapter.driven.jpa.RevenueRecordEntity;
import com.soundledger.data.adapter.driven.jpa.RevenueRecordJpaRepository;
import com.soundledger.domain.error.PersistenceException;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.port.driven.RevenueSourcePort;
import org.springframework.dao.DataAccessException;

import java.util.List;

public final class RevenueSourceAdapter implements RevenueSourcePort {
    private final RevenueRecordJpaRepository repo;

    public RevenueSourceAdapter(RevenueRecordJpaRepository repo) {
        this.repo = repo;
    }

    @Override
    public List<RevenueRecord> fetch(AccountingPeriod period) {
        try {
            return repo.findByPeriodYearAndPeriodQuarterOrderByIdAsc(period.year(), period.quarter())
                    .stream()
                    .map(RevenueRecordEntity::toDomain)
                    .toList();
        } catch (DataAccessException ex) {
            throw new PersistenceException("DB error during revenue fetch for %s".formatted(period), ex);
        }
    }

    @Override
    public int store(List<RevenueRecord> records) {
        try {
            var entities = records.stream().map(RevenueRecordEntity::toEntity).toList();
            return repo.saveAll(entities).size();
        } catch (DataAccessException ex) {
            throw new PersistenceException("DB error during revenue ingest", ex);
        }
    }
}
