package com.soundledger.data.adapter.driven.jpa;

import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.RevenueRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "revenue_records")
public class RevenueRecordEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "artist", nullable = false)
    private String artist;

    @Column(name = "track")
    private String track;

    @Column(name = "platform", nullable = false)
    private String platform;

    @Column(name = "country", nullable = false)
    private String country;

    @Column(name = "period_year", nullable = false)
    private int periodYear;

    @Column(name = "period_quarter", nullable = false)
    private int periodQuarter;

    @Column(name = "streams", nullable = false)
    private long streams;

    // numeric without scale: stored exactly as reported
    @Column(name = "revenue", nullable = false, columnDefinition = "numeric")
    private BigDecimal revenue;

    protected RevenueRecordEntity() {}

    public RevenueRecordEntity(String artist,
                               String track,
                               String platform,
                               String country,
                               int periodYear,
                               int periodQuarter,
                               long streams,
                               BigDecimal revenue
    ) {
        this.artist = artist;
        this.track = track;
        this.platform = platform;
        this.country = country;
        this.periodYear = periodYear;
        this.periodQuarter = periodQuarter;
        this.streams = streams;
        this.revenue = revenue;
    }

    public static RevenueRecordEntity toEntity(RevenueRecord record) {
        return new RevenueRecordEntity(
                record.getArtist(),
                record.getTrack().orElse(null),
                record.getPlatform(),
                record.getCountry(),
                record.getPeriod().year(),
                record.getPeriod().quarter(),
                record.getStreams(),
                record.getRevenue()
        );
    }

    public static RevenueRecord toDomain(RevenueRecordEntity entity) {
        return RevenueRecord.of(
                entity.artist,
                entity.track,
                entity.platform,
                entity.country,
                AccountingPeriod.of(entity.periodYear, entity.periodQuarter),
                entity.streams,
                entity.revenue
        );
    }
}
