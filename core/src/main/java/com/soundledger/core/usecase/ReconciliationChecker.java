package com.soundledger.core.usecase;

import com.soundledger.domain.model.reconciliation.DiscrepancyRecord;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.Payout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares computed net payouts against what was actually paid out.
 * Artists that only appear in the actual payouts are not reported.
 */
public final class ReconciliationChecker {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationChecker.class);

    public List<DiscrepancyRecord> reconcile(AccountingPeriod period,
                                             List<Payout> payouts,
                                             Map<String, BigDecimal> actualPayouts
    ) {
        var discrepancies = payouts
                .stream()
                .map(p -> check(period, p, actualPayouts.get(p.getArtist())))
                .flatMap(Optional::stream)
                .toList();

        discrepancies.forEach(d -> log.warn(
                "Payout discrepancy for {} in {}: {} (computed {}, actual {})",
                d.getArtist(),
                period,
                d.getKind().code(),
                d.getComputed().toPlainString(),
                d.getActual().map(BigDecimal::toPlainString).orElse("none")
        ));

        return discrepancies;
    }

    private static Optional<DiscrepancyRecord> check(AccountingPeriod period, Payout payout, BigDecimal actual) {
        var computed = payout.getNetPayout();

        if (actual == null) {
            return Optional.of(DiscrepancyRecord.missingActual(payout.getArtist(), period, computed));
        }
        if (actual.compareTo(computed) != 0) {
            return Optional.of(DiscrepancyRecord.amountMismatch(payout.getArtist(), period, computed, actual));
        }
        return Optional.empty();
    }
}
