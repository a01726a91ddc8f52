package com.soundledger.domain.model.contract;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Optional;

import static com.soundledger.domain.model.DomainValidator.assertValid;

/**
 * Disagreement between the share the engine pays with and the share in the contract registry.
 */
public final class SplitMismatch {
    @NotBlank(message = "Artist is required")
    private final String artist;

    @NotNull(message = "Mismatch kind is required")
    private final SplitMismatchKind kind;

    @NotNull(message = "Engine fraction is required")
    private final BigDecimal engineFraction;

    private final BigDecimal registryFraction;

    private SplitMismatch(String artist,
                          SplitMismatchKind kind,
                          BigDecimal engineFraction,
                          BigDecimal registryFraction
    ) {
        this.artist = artist;
        this.kind = kind;
        this.engineFraction = engineFraction;
        this.registryFraction = registryFraction;
    }

    public static SplitMismatch missingInRegistry(String artist, BigDecimal engineFraction) {
        return assertValid(new SplitMismatch(artist, SplitMismatchKind.MISSING_IN_REGISTRY, engineFraction, null));
    }

    public static SplitMismatch valueMismatch(String artist, BigDecimal engineFraction, BigDecimal registryFraction) {
        return assertValid(new SplitMismatch(artist, SplitMismatchKind.VALUE_MISMATCH, engineFraction, registryFraction));
    }

    public boolean isBlocking() {
        return kind.isBlocking();
    }

    public String getArtist() {
        return artist;
    }

    public SplitMismatchKind getKind() {
        return kind;
    }

    public BigDecimal getEngineFraction() {
        return engineFraction;
    }

    public Optional<BigDecimal> getRegistryFraction() {
        return Optional.ofNullable(registryFraction);
    }
}
