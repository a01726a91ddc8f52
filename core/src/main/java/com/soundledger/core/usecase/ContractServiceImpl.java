package com.soundledger.core.usecase;

import com.soundledger.domain.error.NotFoundException;
import com.soundledger.domain.model.contract.ContractExpiry;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.model.contract.ContractStatus;
import com.soundledger.domain.model.contract.ContractSummary;
import com.soundledger.domain.model.contract.SplitMismatch;
import com.soundledger.domain.model.contract.SplitMismatchKind;
import com.soundledger.domain.model.royalty.AuditEntry;
import com.soundledger.domain.model.royalty.AuditLog;
import com.soundledger.domain.model.royalty.ShareTable;
import com.soundledger.domain.port.driven.ContractRegistryPort;
import com.soundledger.domain.port.driving.ContractServicePort;
import com.soundledger.domain.port.driving.EscalationPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.soundledger.domain.model.escalation.SourceComponent.CONTRACT_MANAGER;

public final class ContractServiceImpl implements ContractServicePort {
    private static final Logger log = LoggerFactory.getLogger(ContractServiceImpl.class);

    private final ContractRegistryPort registry;
    private final ShareTable shareTable;
    private final EscalationPort escalations;
    private final Clock clock;
    private final SplitConsistencyChecker splitChecker = new SplitConsistencyChecker();
    private final AuditLog auditLog = new AuditLog();
    private final ReentrantLock updateLock = new ReentrantLock();

    public ContractServiceImpl(ContractRegistryPort registry,
                               ShareTable shareTable,
                               EscalationPort escalations,
                               Clock clock
    ) {
        this.registry = registry;
        this.shareTable = shareTable;
        this.escalations = escalations;
        this.clock = clock;
    }

    @Override
    public ContractRecord addContract(ContractRecord contract) {
        var saved = registry.save(contract);
        log.info("Contract added for {} (split {})", saved.getArtist(), saved.getSplitFraction().toPlainString());
        return saved;
    }

    @Override
    public ContractRecord getContract(String artist) {
        return registry.findByArtist(artist)
                .orElseThrow(() -> new NotFoundException("No contract for artist " + artist));
    }

    @Override
    public List<ContractRecord> contracts() {
        return registry.findAll();
    }

    @Override
    public AuditEntry updateSplit(String artist, BigDecimal fraction, String reason, String actor) {
        ShareTable.requireFraction(artist, fraction);

        updateLock.lock();
        try {
            var contract = getContract(artist);
            var audit = AuditEntry.of(clock.instant(), artist, contract.getSplitFraction(), fraction, reason, actor);

            registry.save(contract.withSplitFraction(fraction));
            auditLog.append(audit);

            log.info(
                    "Contract split for {} changed from {} to {} by {}: {}",
                    artist,
                    contract.getSplitFraction().toPlainString(),
                    fraction.toPlainString(),
                    actor,
                    reason
            );
            return audit;
        } finally {
            updateLock.unlock();
        }
    }

    @Override
    public List<SplitMismatch> verifySplits() {
        var mismatches = splitChecker.verify(shareTable.snapshot(), registry.snapshot());

        mismatches.forEach(m -> escalations.escalate(issueKindFor(m), CONTRACT_MANAGER, describe(m)));
        if (mismatches.isEmpty()) {
            log.info("All {} engine splits agree with the contract registry", shareTable.size());
        }

        return mismatches;
    }

    @Override
    public List<ContractExpiry> checkExpirations(int daysAhead) {
        if (daysAhead < 0) {
            throw new IllegalArgumentException("Days ahead cannot be negative, got " + daysAhead);
        }

        final LocalDate today = LocalDate.now(clock);
        final LocalDate deadline = today.plusDays(daysAhead);

        return registry.findAll()
                .stream()
                .filter(c -> c.getExpiryDate().isPresent())
                .filter(c -> !c.getExpiryDate().get().isAfter(deadline))
                .map(c -> {
                    var expiry = c.getExpiryDate().get();
                    return ContractExpiry.of(c.getArtist(), expiry, ChronoUnit.DAYS.between(today, expiry));
                })
                .sorted(Comparator.comparingLong(ContractExpiry::daysLeft).thenComparing(ContractExpiry::artist))
                .toList();
    }

    @Override
    public ContractSummary summary() {
        var contracts = registry.findAll();

        var active = contracts.stream().filter(c -> c.getStatus() == ContractStatus.ACTIVE).toList();

        var averageActiveSplit = active.isEmpty()
                ? BigDecimal.ZERO
                : active.stream()
                        .map(ContractRecord::getSplitFraction)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)
                        .divide(BigDecimal.valueOf(active.size()), 4, RoundingMode.HALF_UP);

        return new ContractSummary(
                contracts.size(),
                active.size(),
                count(contracts, ContractStatus.EXPIRED),
                count(contracts, ContractStatus.PLACEHOLDER),
                averageActiveSplit,
                (int) contracts.stream().filter(c -> c.getFilePath().isPresent()).count(),
                auditLog.size()
        );
    }

    @Override
    public List<AuditEntry> auditLog() {
        return auditLog.entries();
    }

    private static int count(List<ContractRecord> contracts, ContractStatus status) {
        return (int) contracts.stream().filter(c -> c.getStatus() == status).count();
    }

    private static String issueKindFor(SplitMismatch m) {
        return m.getKind() == SplitMismatchKind.VALUE_MISMATCH ? "split_mismatch" : "split_missing_in_registry";
    }

    private static String describe(SplitMismatch m) {
        return "%s: engine split %s, contract split %s".formatted(
                m.getArtist(),
                m.getEngineFraction().toPlainString(),
                m.getRegistryFraction().map(BigDecimal::toPlainString).orElse("none")
        );
    }
}
