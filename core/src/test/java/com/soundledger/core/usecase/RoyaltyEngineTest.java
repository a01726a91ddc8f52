package com.soundledger.core.usecase;

import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceLedger;
import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.model.royalty.ShareTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.SoftAssertions.assertSoftly;

final class RoyaltyEngineTest {
    private final Clock fixed = Clock.fixed(Instant.parse("2025-10-01T00:00:00Z"), ZoneOffset.UTC);
    private final AccountingPeriod period = AccountingPeriod.of(2025, 4);

    private final ShareTable shares = new ShareTable(fixed);
    private final AdvanceLedger advances = new AdvanceLedger();
    private final RoyaltyEngine engine = new RoyaltyEngine(shares, advances);

    private RevenueRecord row(String artist, String track, long streams, String revenue) {
        return RevenueRecord.of(artist, track, "spotify", "NL", period, streams, new BigDecimal(revenue));
    }

    @Test
    void compute_nets_advance_against_artist_share() {
        shares.set("Nova", new BigDecimal("0.70"), "contract", "label-ops");
        advances.set("Nova", new BigDecimal("7500"));

        var result = engine.compute(period, List.of(row("Nova", "t1", 1_000_000, "10000.00")));

        assertSoftly(s -> {
            s.assertThat(result.payouts()).hasSize(1);
            s.assertThat(result.hasWarnings()).isFalse();

            var p = result.payouts().get(0);
            s.assertThat(p.getGrossRevenue()).isEqualByComparingTo("10000.00");
            s.assertThat(p.getArtistShare()).isEqualByComparingTo("7000.00");
            s.assertThat(p.getAdvanceDeducted()).isEqualByComparingTo("7000.00");
            s.assertThat(p.getNetPayout()).isEqualByComparingTo("0.00");
        });
    }

    @Test
    void compute_deducts_small_advance_fully() {
        shares.set("Echo", new BigDecimal("0.80"), "contract", "label-ops");
        advances.set("Echo", new BigDecimal("100"));

        var result = engine.compute(period, List.of(row("Echo", "t1", 50_000, "500")));
        var p = result.payouts().get(0);

        assertSoftly(s -> {
            s.assertThat(p.getArtistShare()).isEqualByComparingTo("400.00");
            s.assertThat(p.getAdvanceDeducted()).isEqualByComparingTo("100");
            s.assertThat(p.getNetPayout()).isEqualByComparingTo("300.00");
        });
    }

    @Test
    void compute_skips_artist_without_split_and_warns() {
        shares.set("A", new BigDecimal("0.5"), "contract", "label-ops");

        var result = engine.compute(period, List.of(
                row("A", "t1", 10, "100"),
                row("B", "t2", 10, "50")
        ));

        assertSoftly(s -> {
            s.assertThat(result.payouts()).extracting(Payout::getArtist).containsExactly("A");
            s.assertThat(result.payouts().get(0).getNetPayout()).isEqualByComparingTo("50.00");
            s.assertThat(result.warnings()).hasSize(1);
            s.assertThat(result.warnings().get(0).artist()).isEqualTo("B");
            s.assertThat(result.warnings().get(0).grossRevenue()).isEqualByComparingTo("50");
        });
    }

    @Test
    void compute_aggregates_rows_per_artist_in_first_seen_order() {
        shares.set("Zed", new BigDecimal("0.5"), "contract", "label-ops");
        shares.set("Amy", new BigDecimal("0.5"), "contract", "label-ops");

        var result = engine.compute(period, List.of(
                row("Zed", "t1", 10, "0.10"),
                row("Amy", "a1", 5, "1.00"),
                row("Zed", "t1", 20, "0.20"),
                row("Zed", "t2", 30, "0.30"),
                row("Zed", null, 40, "0.40")
        ));

        assertSoftly(s -> {
            s.assertThat(result.payouts()).extracting(Payout::getArtist).containsExactly("Zed", "Amy");

            var zed = result.payouts().get(0);
            s.assertThat(zed.getGrossRevenue()).isEqualByComparingTo("1.00");
            s.assertThat(zed.getStreamCount()).isEqualTo(100);
            s.assertThat(zed.getTrackCount()).isEqualTo(2);
            s.assertThat(zed.getArtistShare()).isEqualByComparingTo("0.50");
        });
    }

    @Test
    void compute_rounds_share_half_up_to_cents() {
        shares.set("Ray", new BigDecimal("0.333"), "contract", "label-ops");

        var result = engine.compute(period, List.of(row("Ray", "t1", 1, "10.015")));

        // 10.015 * 0.333 = 3.334995
        assertSoftly(s -> s.assertThat(result.payouts().get(0).getArtistShare()).isEqualTo(new BigDecimal("3.33")));
    }

    @Test
    void compute_rounds_exact_half_cent_tie_up() {
        shares.set("Ray", new BigDecimal("0.5"), "contract", "label-ops");

        var result = engine.compute(period, List.of(row("Ray", "t1", 1, "10.01")));

        // 10.01 * 0.5 = 5.005
        assertSoftly(s -> s.assertThat(result.payouts().get(0).getArtistShare()).isEqualByComparingTo("5.01"));
    }

    @Test
    void compute_is_idempotent_and_leaves_ledger_untouched() {
        shares.set("Nova", new BigDecimal("0.70"), "contract", "label-ops");
        advances.set("Nova", new BigDecimal("7500"));
        var rows = List.of(row("Nova", "t1", 1_000, "10000"));

        var first = engine.compute(period, rows);
        var second = engine.compute(period, rows);

        assertSoftly(s -> {
            s.assertThat(second.payouts().get(0).getNetPayout())
                    .isEqualByComparingTo(first.payouts().get(0).getNetPayout());
            s.assertThat(second.payouts().get(0).getAdvanceDeducted())
                    .isEqualByComparingTo(first.payouts().get(0).getAdvanceDeducted());
            s.assertThat(advances.get("Nova")).isEqualByComparingTo("7500");
        });
    }

    @Test
    void compute_with_filter_only_pays_that_artist() {
        shares.set("A", new BigDecimal("0.5"), "contract", "label-ops");
        shares.set("B", new BigDecimal("0.5"), "contract", "label-ops");

        var rows = List.of(row("A", "t1", 1, "10"), row("B", "t2", 1, "20"));

        assertSoftly(s -> {
            s.assertThat(engine.compute(period, rows, "B").payouts()).extracting(Payout::getArtist).containsExactly("B");
            s.assertThat(engine.compute(period, rows, "Nobody").payouts()).isEmpty();
            s.assertThat(engine.compute(period, rows, "Nobody").warnings()).isEmpty();
        });
    }

    @Test
    void compute_ignores_rows_of_other_periods() {
        shares.set("A", new BigDecimal("1"), "contract", "label-ops");

        var other = RevenueRecord.of("A", "t1", "spotify", "NL", AccountingPeriod.of(2025, 3), 1, new BigDecimal("99"));

        var result = engine.compute(period, List.of(other, row("A", "t1", 1, "1")));

        assertSoftly(s -> s.assertThat(result.payouts().get(0).getGrossRevenue()).isEqualByComparingTo("1"));
    }

    @Test
    void compute_every_payout_satisfies_net_invariant() {
        shares.set("A", new BigDecimal("0.15"), "contract", "label-ops");
        shares.set("B", new BigDecimal("1"), "contract", "label-ops");
        shares.set("C", BigDecimal.ZERO, "contract", "label-ops");
        advances.set("A", new BigDecimal("3.50"));
        advances.set("B", new BigDecimal("1000000"));
        advances.set("C", new BigDecimal("10"));

        var result = engine.compute(period, List.of(
                row("A", "t1", 7, "12.34"),
                row("B", "t2", 9, "999.99"),
                row("C", "t3", 3, "45.00")
        ));

        assertSoftly(s -> result.payouts().forEach(p -> {
            s.assertThat(p.getNetPayout()).as("net for %s", p.getArtist())
                    .isEqualByComparingTo(p.getArtistShare().subtract(p.getAdvanceDeducted()));
            s.assertThat(p.getAdvanceDeducted().signum()).as("deducted for %s", p.getArtist()).isGreaterThanOrEqualTo(0);
            s.assertThat(p.getAdvanceDeducted()).as("deducted vs share for %s", p.getArtist())
                    .isLessThanOrEqualTo(p.getArtistShare());
            s.assertThat(p.getAdvanceDeducted()).as("deducted vs balance for %s", p.getArtist())
                    .isLessThanOrEqualTo(advances.get(p.getArtist()));
        }));
    }

    @Test
    void compute_with_no_rows_returns_empty_computation() {
        var result = engine.compute(period, List.of());

        assertSoftly(s -> {
            s.assertThat(result.payouts()).isEmpty();
            s.assertThat(result.warnings()).isEmpty();
        });
    }
}
