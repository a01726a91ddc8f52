package com.soundledger.domain.model.royalty;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Optional;

import static com.soundledger.domain.model.DomainValidator.assertValid;

public final class RevenueRecord {
    @NotBlank(message = "Artist is required")
    private final String artist;

    private final String track;

    @NotBlank(message = "Platform is required")
    private final String platform;

    @NotBlank(message = "Country is required")
    private final String country;

    @NotNull(message = "Period is required")
    private final AccountingPeriod period;

    @Min(value = 0, message = "Stream count cannot be negative.")
    private final long streams;

    @NotNull(message = "Revenue amount is required")
    @DecimalMin(value = "0", message = "Revenue amount cannot be negative.")
    private final BigDecimal revenue;

    private RevenueRecord(String artist,
                          String track,
                          String platform,
                          String country,
                          AccountingPeriod period,
                          long streams,
                          BigDecimal revenue
    ) {
        this.artist = artist;
        this.track = track;
        this.platform = platform;
        this.country = country;
        this.period = period;
        this.streams = streams;
        this.revenue = revenue;
    }

    public static RevenueRecord of(String artist,
                                   String track,
                                   String platform,
                                   String country,
                                   AccountingPeriod period,
                                   long streams,
                                   BigDecimal revenue
    ) {
        return assertValid(new RevenueRecord(
                artist,
                blankToNull(track),
                platform,
                country,
                period,
                streams,
                revenue
        ));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public String getArtist() {
        return artist;
    }

    public Optional<String> getTrack() {
        return Optional.ofNullable(track);
    }

    public String getPlatform() {
        return platform;
    }

    public String getCountry() {
        return country;
    }

    public AccountingPeriod getPeriod() {
        return period;
    }

    public long getStreams() {
        return streams;
    }

    public BigDecimal getRevenue() {
        return revenue;
    }
}
