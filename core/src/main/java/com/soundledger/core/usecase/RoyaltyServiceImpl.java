package com.soundledger.core.usecase;

import com.soundledger.domain.error.ConfigurationMissingException;
import com.soundledger.domain.model.contract.SplitMismatch;
import com.soundledger.domain.model.contract.SplitMismatchKind;
import com.soundledger.domain.model.reconciliation.DiscrepancyKind;
import com.soundledger.domain.model.reconciliation.DiscrepancyRecord;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceBalance;
import com.soundledger.domain.model.royalty.AdvanceLedger;
import com.soundledger.domain.model.royalty.AuditEntry;
import com.soundledger.domain.model.royalty.Computation;
import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.model.royalty.PayoutStatement;
import com.soundledger.domain.model.royalty.ReleaseStatus;
import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.model.royalty.ShareTable;
import com.soundledger.domain.port.driven.ContractRegistryPort;
import com.soundledger.domain.port.driven.RevenueSourcePort;
import com.soundledger.domain.port.driving.EscalationPort;
import com.soundledger.domain.port.driving.RoyaltyServicePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.soundledger.domain.model.escalation.SourceComponent.CONTRACT_MANAGER;
import static com.soundledger.domain.model.escalation.SourceComponent.ROYALTY_ENGINE;

public final class RoyaltyServiceImpl implements RoyaltyServicePort {
    private static final Logger log = LoggerFactory.getLogger(RoyaltyServiceImpl.class);

    private final RevenueSourcePort revenueSource;
    private final ContractRegistryPort contractRegistry;
    private final EscalationPort escalations;
    private final RoyaltyEngine engine;
    private final ReconciliationChecker reconciliationChecker;
    private final SplitConsistencyChecker splitChecker;
    private final ShareTable shareTable;
    private final AdvanceLedger advanceLedger;
    private final PayoutReportExporter reportExporter;

    private final Map<AccountingPeriod, Set<String>> settledArtists = new ConcurrentHashMap<>();

    /**
     * @param revenueSource may be {@code null} when no revenue feed is wired; every call that needs
     *                      revenue then fails with {@link ConfigurationMissingException}
     */
    public RoyaltyServiceImpl(RevenueSourcePort revenueSource,
                              ContractRegistryPort contractRegistry,
                              EscalationPort escalations,
                              ShareTable shareTable,
                              AdvanceLedger advanceLedger,
                              PayoutReportExporter reportExporter
    ) {
        this.revenueSource = revenueSource;
        this.contractRegistry = contractRegistry;
        this.escalations = escalations;
        this.shareTable = shareTable;
        this.advanceLedger = advanceLedger;
        this.reportExporter = reportExporter;
        this.engine = new RoyaltyEngine(shareTable, advanceLedger);
        this.reconciliationChecker = new ReconciliationChecker();
        this.splitChecker = new SplitConsistencyChecker();
    }

    @Override
    public Computation calculate(AccountingPeriod period) {
        return calculate(period, null);
    }

    @Override
    public Computation calculate(AccountingPeriod period, String artist) {
        var rows = requireRevenueSource().fetch(period);
        var computation = engine.compute(period, rows, blankToNull(artist));

        log.info(
                "Calculated {} payouts for {} from {} revenue rows, {} artists without split",
                computation.payouts().size(),
                period,
                rows.size(),
                computation.warnings().size()
        );
        return computation;
    }

    @Override
    public int ingestRevenue(List<RevenueRecord> records) {
        if (records.isEmpty()) return 0;

        var stored = requireRevenueSource().store(records);
        log.info("Ingested {} revenue rows", stored);
        return stored;
    }

    @Override
    public List<DiscrepancyRecord> reconcile(AccountingPeriod period, Map<String, BigDecimal> actualPayouts) {
        var payouts = calculate(period).payouts();
        var discrepancies = reconciliationChecker.reconcile(period, payouts, actualPayouts);

        discrepancies.forEach(d -> escalations.escalate(
                issueKindFor(d.getKind()),
                ROYALTY_ENGINE,
                describe(d)
        ));

        return discrepancies;
    }

    @Override
    public List<PayoutStatement> release(AccountingPeriod period, Set<String> overrides) {
        var payouts = calculate(period).payouts();
        var payingArtists = payouts.stream().map(Payout::getArtist).collect(Collectors.toSet());

        var enginePaid = shareTable.snapshot()
                .entrySet()
                .stream()
                .filter(e -> payingArtists.contains(e.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        var mismatches = splitChecker.verify(enginePaid, contractRegistry.snapshot())
                .stream()
                .collect(Collectors.toMap(SplitMismatch::getArtist, Function.identity()));

        var statements = new ArrayList<PayoutStatement>(payouts.size());
        for (var payout : payouts) {
            var status = statusFor(mismatches.get(payout.getArtist()), overrides.contains(payout.getArtist()));
            if (status == ReleaseStatus.BLOCKED) {
                escalations.escalate("split_mismatch", CONTRACT_MANAGER, describe(period, mismatches.get(payout.getArtist())));
            }
            statements.add(new PayoutStatement(payout, status));
        }

        log.info("Released {} payouts for {}, {} blocked", statements.size(), period, statements.stream().filter(s -> !s.isReleasable()).count());
        return statements;
    }

    @Override
    public List<PayoutStatement> settle(AccountingPeriod period, Set<String> overrides) {
        var statements = release(period, overrides);
        var settled = settledArtists.computeIfAbsent(period, p -> ConcurrentHashMap.newKeySet());

        synchronized (settled) {
            statements.stream()
                    .filter(PayoutStatement::isReleasable)
                    .map(PayoutStatement::payout)
                    .filter(p -> !settled.contains(p.getArtist()))
                    .forEach(p -> settleAdvance(period, p, settled));
        }

        return statements;
    }

    private void settleAdvance(AccountingPeriod period, Payout payout, Set<String> settled) {
        var artist = payout.getArtist();
        var deducted = payout.getAdvanceDeducted();
        var applied = advanceLedger.settleUpTo(artist, deducted);
        settled.add(artist);

        if (applied.compareTo(deducted) < 0) {
            log.warn(
                    "Advance for {} dropped below the computed deduction for {}, settled {} instead of {}",
                    artist,
                    period,
                    applied.toPlainString(),
                    deducted.toPlainString()
            );
        }
        log.info("Settled {} of {}'s advance for {}, {} remaining", applied.toPlainString(), artist, period, advanceLedger.get(artist).toPlainString());
    }

    @Override
    public AuditEntry setSplit(String artist, BigDecimal fraction, String reason, String actor) {
        var audit = shareTable.set(artist, fraction, reason, actor);
        log.info(
                "Split for {} changed from {} to {} by {}: {}",
                artist,
                audit.getOldFraction().map(BigDecimal::toPlainString).orElse("none"),
                fraction.toPlainString(),
                actor,
                reason
        );
        return audit;
    }

    @Override
    public void setAdvance(String artist, BigDecimal balance) {
        advanceLedger.set(artist, balance);
        log.info("Advance balance for {} set to {}", artist, balance.toPlainString());
    }

    @Override
    public List<AdvanceBalance> advances(String artist) {
        var filter = blankToNull(artist);

        return advanceLedger.balances()
                .stream()
                .filter(b -> filter == null || filter.equals(b.artist()))
                .filter(b -> b.remainingBalance().signum() > 0)
                .toList();
    }

    @Override
    public AdvanceBalance balance(String artist) {
        return AdvanceBalance.of(artist, advanceLedger.get(artist));
    }

    @Override
    public List<String> exportReports(AccountingPeriod period) {
        if (reportExporter == null) {
            throw new ConfigurationMissingException("Report output is not configured");
        }
        return reportExporter.export(calculate(period).payouts());
    }

    private RevenueSourcePort requireRevenueSource() {
        if (revenueSource == null) {
            throw new ConfigurationMissingException("Revenue source is not configured");
        }
        return revenueSource;
    }

    private static ReleaseStatus statusFor(SplitMismatch mismatch, boolean overridden) {
        if (mismatch == null) return ReleaseStatus.FINAL;
        if (mismatch.getKind() == SplitMismatchKind.MISSING_IN_REGISTRY) return ReleaseStatus.PROVISIONAL;

        return overridden ? ReleaseStatus.OVERRIDDEN : ReleaseStatus.BLOCKED;
    }

    private static String issueKindFor(DiscrepancyKind kind) {
        return "payout_" + kind.code();
    }

    private static String describe(DiscrepancyRecord d) {
        return "%s %s: computed %s, actual %s".formatted(
                d.getArtist(),
                d.getPeriod(),
                d.getComputed().toPlainString(),
                d.getActual().map(BigDecimal::toPlainString).orElse("none")
        );
    }

    private static String describe(AccountingPeriod period, SplitMismatch m) {
        return "%s %s: engine split %s, contract split %s, payout blocked".formatted(
                m.getArtist(),
                period,
                m.getEngineFraction().toPlainString(),
                m.getRegistryFraction().map(BigDecimal::toPlainString).orElse("none")
        );
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
