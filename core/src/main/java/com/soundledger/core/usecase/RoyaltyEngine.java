package com.soundledger.core.usecase;

import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceLedger;
import com.soundledger.domain.model.royalty.Computation;
import com.soundledger.domain.model.royalty.MissingSplitWarning;
import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.model.royalty.ShareTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.math.BigDecimal.ZERO;

/**
 * Turns revenue rows into per-artist payouts for one accounting period.
 * <p>
 * Computation is read-only: shares and advance balances are snapshotted once per call and neither
 * table is modified, so computing twice over the same inputs yields the same payouts.
 */
public final class RoyaltyEngine {
    private static final Logger log = LoggerFactory.getLogger(RoyaltyEngine.class);

    static final int MONEY_SCALE = 2;

    private final ShareTable shareTable;
    private final AdvanceLedger advanceLedger;

    public RoyaltyEngine(ShareTable shareTable, AdvanceLedger advanceLedger) {
        this.shareTable = shareTable;
        this.advanceLedger = advanceLedger;
    }

    public Computation compute(AccountingPeriod period, List<RevenueRecord> rows) {
        return compute(period, rows, null);
    }

    /**
     * @param artistFilter only rows of this artist are considered; {@code null} means all artists
     */
    public Computation compute(AccountingPeriod period, List<RevenueRecord> rows, String artistFilter) {
        final Map<String, BigDecimal> shares = shareTable.snapshot();
        final Map<String, BigDecimal> balances = advanceLedger.snapshot();

        final var totalsByArtist = partition(period, rows, artistFilter);

        final var payouts = new ArrayList<Payout>(totalsByArtist.size());
        final var warnings = new ArrayList<MissingSplitWarning>();

        totalsByArtist.forEach((artist, totals) -> {
            var fraction = shares.get(artist);
            if (fraction == null) {
                var warning = new MissingSplitWarning(artist, period, totals.gross);
                log.warn(warning.message());
                warnings.add(warning);
                return;
            }

            payouts.add(payoutFor(artist, period, totals, fraction, balances.getOrDefault(artist, ZERO)));
        });

        return new Computation(payouts, warnings);
    }

    private static Map<String, ArtistTotals> partition(AccountingPeriod period,
                                                       List<RevenueRecord> rows,
                                                       String artistFilter
    ) {
        var totals = new LinkedHashMap<String, ArtistTotals>();

        for (var row : rows) {
            if (!row.getPeriod().equals(period)) continue;
            if (artistFilter != null && !artistFilter.equals(row.getArtist())) continue;

            totals.computeIfAbsent(row.getArtist(), a -> new ArtistTotals()).add(row);
        }

        return totals;
    }

    private static Payout payoutFor(String artist,
                                    AccountingPeriod period,
                                    ArtistTotals totals,
                                    BigDecimal fraction,
                                    BigDecimal balance
    ) {
        final BigDecimal share = totals.gross.multiply(fraction).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        final BigDecimal deducted = balance.min(share);

        return Payout.of(
                artist,
                period,
                totals.gross,
                fraction,
                share,
                deducted,
                share.subtract(deducted),
                totals.tracks.size(),
                totals.streams
        );
    }

    private static final class ArtistTotals {
        private BigDecimal gross = ZERO;
        private long streams;
        private final Set<String> tracks = new HashSet<>();

        void add(RevenueRecord row) {
            gross = gross.add(row.getRevenue());
            streams = Math.addExact(streams, row.getStreams());
            row.getTrack().ifPresent(tracks::add);
        }
    }
}
