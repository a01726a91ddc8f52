package com.soundledger.domain.model.royalty;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import static com.soundledger.domain.model.DomainValidator.assertValid;

/**
 * What one artist is owed for one period. Always derived from revenue rows, shares and advances;
 * never the source of truth for any of them.
 */
public final class Payout {
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^\\p{L}\\p{N}._-]+");

    @NotBlank(message = "Artist is required")
    private final String artist;

    @NotNull(message = "Period is required")
    private final AccountingPeriod period;

    @NotNull(message = "Gross revenue is required")
    @DecimalMin(value = "0", message = "You cannot have negative gross revenue.")
    private final BigDecimal grossRevenue;

    @NotNull(message = "Share fraction is required")
    @DecimalMin(value = "0", message = "Share fraction cannot be below 0.")
    @DecimalMax(value = "1", message = "Share fraction cannot be above 1.")
    private final BigDecimal shareFraction;

    @NotNull(message = "Artist share is required")
    @DecimalMin(value = "0", message = "Artist share cannot be negative.")
    private final BigDecimal artistShare;

    @NotNull(message = "Advance deducted is required")
    @DecimalMin(value = "0", message = "Advance deducted cannot be negative.")
    private final BigDecimal advanceDeducted;

    @NotNull(message = "Net payout is required")
    private final BigDecimal netPayout;

    @Min(value = 0, message = "Track count cannot be negative.")
    private final int trackCount;

    @Min(value = 0, message = "Stream count cannot be negative.")
    private final long streamCount;

    private Payout(String artist,
                   AccountingPeriod period,
                   BigDecimal grossRevenue,
                   BigDecimal shareFraction,
                   BigDecimal artistShare,
                   BigDecimal advanceDeducted,
                   BigDecimal netPayout,
                   int trackCount,
                   long streamCount
    ) {
        this.artist = artist;
        this.period = period;
        this.grossRevenue = grossRevenue;
        this.shareFraction = shareFraction;
        this.artistShare = artistShare;
        this.advanceDeducted = advanceDeducted;
        this.netPayout = netPayout;
        this.trackCount = trackCount;
        this.streamCount = streamCount;
    }

    public static Payout of(String artist,
                            AccountingPeriod period,
                            BigDecimal grossRevenue,
                            BigDecimal shareFraction,
                            BigDecimal artistShare,
                            BigDecimal advanceDeducted,
                            BigDecimal netPayout,
                            int trackCount,
                            long streamCount
    ) {
        return assertValid(new Payout(
                artist,
                period,
                grossRevenue,
                shareFraction,
                artistShare,
                advanceDeducted,
                netPayout,
                trackCount,
                streamCount
        ));
    }

    @AssertTrue(message = "Net payout must equal artist share minus advance deducted.")
    public boolean isNetConsistent() {
        if (artistShare == null || advanceDeducted == null || netPayout == null) return true;

        return netPayout.compareTo(artistShare.subtract(advanceDeducted)) == 0;
    }

    @AssertTrue(message = "Advance deducted cannot exceed the artist share.")
    public boolean isDeductionCovered() {
        if (artistShare == null || advanceDeducted == null) return true;

        return advanceDeducted.compareTo(artistShare) <= 0;
    }

    /**
     * Filename-safe label for report collaborators, e.g. {@code royalty_Some_Artist_2025-Q4}.
     */
    public String reportLabel() {
        var safeArtist = UNSAFE_FILENAME_CHARS.matcher(artist.trim()).replaceAll("_");
        return "royalty_%s_%s".formatted(safeArtist, period.label());
    }

    public String getArtist() {
        return artist;
    }

    public AccountingPeriod getPeriod() {
        return period;
    }

    public BigDecimal getGrossRevenue() {
        return grossRevenue;
    }

    public BigDecimal getShareFraction() {
        return shareFraction;
    }

    public BigDecimal getArtistShare() {
        return artistShare;
    }

    public BigDecimal getAdvanceDeducted() {
        return advanceDeducted;
    }

    public BigDecimal getNetPayout() {
        return netPayout;
    }

    public int getTrackCount() {
        return trackCount;
    }

    public long getStreamCount() {
        return streamCount;
    }
}
