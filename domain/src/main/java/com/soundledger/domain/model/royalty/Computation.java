package com.soundledger.domain.model.royalty;

import java.util.List;

/**
 * Payouts of one compute call plus the artists that were skipped for lack of a split.
 * An empty payout list with no warnings means no artist had revenue.
 */
public record Computation(List<Payout> payouts, List<MissingSplitWarning> warnings) {
    public Computation {
        payouts = List.copyOf(payouts);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
