package com.soundledger.domain.model.reconciliation;

import com.soundledger.domain.model.royalty.AccountingPeriod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Optional;

import static com.soundledger.domain.model.DomainValidator.assertValid;

public final class DiscrepancyRecord {
    @NotBlank(message = "Artist is required")
    private final String artist;

    @NotNull(message = "Period is required")
    private final AccountingPeriod period;

    @NotNull(message = "Discrepancy kind is required")
    private final DiscrepancyKind kind;

    @NotNull(message = "Computed amount is required")
    private final BigDecimal computed;

    private final BigDecimal actual;

    private final BigDecimal difference;

    private DiscrepancyRecord(String artist,
                              AccountingPeriod period,
                              DiscrepancyKind kind,
                              BigDecimal computed,
                              BigDecimal actual,
                              BigDecimal difference
    ) {
        this.artist = artist;
        this.period = period;
        this.kind = kind;
        this.computed = computed;
        this.actual = actual;
        this.difference = difference;
    }

    public static DiscrepancyRecord missingActual(String artist, AccountingPeriod period, BigDecimal computed) {
        return assertValid(new DiscrepancyRecord(
                artist,
                period,
                DiscrepancyKind.MISSING_ACTUAL,
                computed,
                null,
                null
        ));
    }

    public static DiscrepancyRecord amountMismatch(String artist,
                                                   AccountingPeriod period,
                                                   BigDecimal computed,
                                                   BigDecimal actual
    ) {
        return assertValid(new DiscrepancyRecord(
                artist,
                period,
                DiscrepancyKind.AMOUNT_MISMATCH,
                computed,
                actual,
                actual.subtract(computed)
        ));
    }

    public String getArtist() {
        return artist;
    }

    public AccountingPeriod getPeriod() {
        return period;
    }

    public DiscrepancyKind getKind() {
        return kind;
    }

    public BigDecimal getComputed() {
        return computed;
    }

    public Optional<BigDecimal> getActual() {
        return Optional.ofNullable(actual);
    }

    /**
     * Signed {@code actual - computed}; absent when there is no actual amount.
     */
    public Optional<BigDecimal> getDifference() {
        return Optional.ofNullable(difference);
    }
}
