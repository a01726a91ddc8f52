package com.soundledger.domain.model.royalty;

import java.math.BigDecimal;

/**
 * An artist had revenue in the period but no share fraction, so no payout was computed.
 */
public record MissingSplitWarning(String artist, AccountingPeriod period, BigDecimal grossRevenue) {
    public String message() {
        return "No split for %s in %s, skipped %s of gross revenue"
                .formatted(artist, period, grossRevenue.toPlainString());
    }
}
