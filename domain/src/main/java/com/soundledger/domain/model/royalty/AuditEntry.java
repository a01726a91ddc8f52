package com.soundledger.domain.model.royalty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static com.soundledger.domain.model.DomainValidator.assertValid;

/**
 * One change of an artist's share fraction. The previous fraction is absent when the artist had none.
 */
public final class AuditEntry {
    @NotNull(message = "Audit timestamp is required")
    private final Instant timestamp;

    @NotBlank(message = "Artist is required")
    private final String artist;

    private final BigDecimal oldFraction;

    @NotNull(message = "New fraction is required")
    private final BigDecimal newFraction;

    @NotBlank(message = "A reason is required for every split change")
    private final String reason;

    @NotBlank(message = "An actor is required for every split change")
    private final String actor;

    private AuditEntry(Instant timestamp,
                       String artist,
                       BigDecimal oldFraction,
                       BigDecimal newFraction,
                       String reason,
                       String actor
    ) {
        this.timestamp = timestamp;
        this.artist = artist;
        this.oldFraction = oldFraction;
        this.newFraction = newFraction;
        this.reason = reason;
        this.actor = actor;
    }

    public static AuditEntry of(Instant timestamp,
                                String artist,
                                BigDecimal oldFraction,
                                BigDecimal newFraction,
                                String reason,
                                String actor
    ) {
        return assertValid(new AuditEntry(timestamp, artist, oldFraction, newFraction, reason, actor));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getArtist() {
        return artist;
    }

    public Optional<BigDecimal> getOldFraction() {
        return Optional.ofNullable(oldFraction);
    }

    public BigDecimal getNewFraction() {
        return newFraction;
    }

    public String getReason() {
        return reason;
    }

    public String getActor() {
        return actor;
    }
}
