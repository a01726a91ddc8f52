package com.soundledger.domain.model.royalty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

import static com.soundledger.domain.model.DomainValidator.assertValid;

public final class ShareEntry {
    @NotBlank(message = "Artist is required")
    private final String artist;

    @NotNull(message = "Share fraction is required")
    @DecimalMin(value = "0", message = "Share fraction cannot be below 0.")
    @DecimalMax(value = "1", message = "Share fraction cannot be above 1.")
    private final BigDecimal fraction;

    @NotNull(message = "Share provenance is required")
    private final ShareProvenance provenance;

    private ShareEntry(String artist, BigDecimal fraction, ShareProvenance provenance) {
        this.artist = artist;
        this.fraction = fraction;
        this.provenance = provenance;
    }

    public static ShareEntry of(String artist, BigDecimal fraction, ShareProvenance provenance) {
        return assertValid(new ShareEntry(artist, fraction, provenance));
    }

    public String getArtist() {
        return artist;
    }

    public BigDecimal getFraction() {
        return fraction;
    }

    public ShareProvenance getProvenance() {
        return provenance;
    }
}
