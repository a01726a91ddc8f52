package com.soundledger.core.usecase;

import com.soundledger.domain.model.contract.SplitMismatch;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class SplitConsistencyChecker {
    /** Differences up to and including this are treated as rounding noise. */
    static final BigDecimal EPSILON = new BigDecimal("0.001");

    /**
     * Checks every artist the engine pays against the contract registry, in artist order.
     */
    public List<SplitMismatch> verify(Map<String, BigDecimal> engineShares, Map<String, BigDecimal> registryShares) {
        var mismatches = new ArrayList<SplitMismatch>();

        engineShares.keySet()
                .stream()
                .sorted()
                .forEach(artist -> {
                    var engine = engineShares.get(artist);
                    var registry = registryShares.get(artist);

                    if (registry == null) {
                        mismatches.add(SplitMismatch.missingInRegistry(artist, engine));
                    } else if (engine.subtract(registry).abs().compareTo(EPSILON) > 0) {
                        mismatches.add(SplitMismatch.valueMismatch(artist, engine, registry));
                    }
                });

        return mismatches;
    }
}
