package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.model.contract.ContractExpiry;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.model.contract.ContractSummary;
import com.soundledger.domain.model.contract.SplitMismatch;
import com.soundledger.domain.model.escalation.Escalation;
import com.soundledger.domain.model.reconciliation.DiscrepancyRecord;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceBalance;
import com.soundledger.domain.model.royalty.AuditEntry;
import com.soundledger.domain.model.royalty.Computation;
import com.soundledger.domain.model.royalty.MissingSplitWarning;
import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.model.royalty.PayoutStatement;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class Response {
    public record ErrorResponse(String error) {}

    public record PayoutResponse(
            String artist,
            String period,                // yyyy-Qn
            BigDecimal grossRevenue,
            BigDecimal shareFraction,
            BigDecimal artistShare,
            BigDecimal advanceDeducted,
            BigDecimal netPayout,
            int tracks,
            long streams
    ) {
        public static PayoutResponse fromDomain(Payout p) {
            return new PayoutResponse(
                    p.getArtist(),
                    p.getPeriod().label(),
                    p.getGrossRevenue(),
                    p.getShareFraction(),
                    p.getArtistShare(),
                    p.getAdvanceDeducted(),
                    p.getNetPayout(),
                    p.getTrackCount(),
                    p.getStreamCount()
            );
        }
    }

    public record WarningResponse(String artist, BigDecimal grossRevenue, String message) {
        public static WarningResponse fromDomain(MissingSplitWarning w) {
            return new WarningResponse(w.artist(), w.grossRevenue(), w.message());
        }
    }

    public record ComputationResponse(
            String period,
            List<PayoutResponse> payouts,
            List<WarningResponse> warnings
    ) {
        public static ComputationResponse fromDomain(AccountingPeriod period, Computation c) {
            return new ComputationResponse(
                    period.label(),
                    c.payouts().stream().map(PayoutResponse::fromDomain).toList(),
                    c.warnings().stream().map(WarningResponse::fromDomain).toList()
            );
        }
    }

    public record IngestResponse(int ingested) {}

    public record DiscrepancyResponse(
            String artist,
            String period,
            String kind,
            BigDecimal computed,
            BigDecimal actual,
            BigDecimal difference
    ) {
        public static DiscrepancyResponse fromDomain(DiscrepancyRecord d) {
            return new DiscrepancyResponse(
                    d.getArtist(),
                    d.getPeriod().label(),
                    d.getKind().name(),
                    d.getComputed(),
                    d.getActual().orElse(null),
                    d.getDifference().orElse(null)
            );
        }
    }

    public record PayoutStatementResponse(String status, boolean releasable, PayoutResponse payout) {
        public static PayoutStatementResponse fromDomain(PayoutStatement s) {
            return new PayoutStatementResponse(
                    s.status().name(),
                    s.isReleasable(),
                    PayoutResponse.fromDomain(s.payout())
            );
        }
    }

    public record AuditEntryResponse(
            Instant timestamp,
            String artist,
            BigDecimal oldFraction,
            BigDecimal newFraction,
            String reason,
            String actor
    ) {
        public static AuditEntryResponse fromDomain(AuditEntry a) {
            return new AuditEntryResponse(
                    a.getTimestamp(),
                    a.getArtist(),
                    a.getOldFraction().orElse(null),
                    a.getNewFraction(),
                    a.getReason(),
                    a.getActor()
            );
        }
    }

    public record AdvanceBalanceResponse(String artist, BigDecimal remainingBalance, String status) {
        public static AdvanceBalanceResponse fromDomain(AdvanceBalance b) {
            return new AdvanceBalanceResponse(b.artist(), b.remainingBalance(), b.status().name());
        }
    }

    public record ExportResponse(String period, List<String> objectKeys) {}

    public record ContractResponse(
            String artist,
            BigDecimal splitFraction,
            LocalDate signedDate,
            LocalDate expiryDate,
            String filePath,
            String fileType,
            String status,
            String notes
    ) {
        public static ContractResponse fromDomain(ContractRecord c) {
            return new ContractResponse(
                    c.getArtist(),
                    c.getSplitFraction(),
                    c.getSignedDate().orElse(null),
                    c.getExpiryDate().orElse(null),
                    c.getFilePath().orElse(null),
                    c.getFileType().name(),
                    c.getStatus().name(),
                    c.getNotes()
            );
        }
    }

    public record SplitMismatchResponse(
            String artist,
            String kind,
            boolean blocking,
            BigDecimal engineFraction,
            BigDecimal registryFraction
    ) {
        public static SplitMismatchResponse fromDomain(SplitMismatch m) {
            return new SplitMismatchResponse(
                    m.getArtist(),
                    m.getKind().name(),
                    m.isBlocking(),
                    m.getEngineFraction(),
                    m.getRegistryFraction().orElse(null)
            );
        }
    }

    public record ContractExpiryResponse(String artist, LocalDate expiryDate, long daysLeft, String status) {
        public static ContractExpiryResponse fromDomain(ContractExpiry e) {
            return new ContractExpiryResponse(e.artist(), e.expiryDate(), e.daysLeft(), e.status().name());
        }
    }

    public record ContractSummaryResponse(
            int total,
            int active,
            int expired,
            int placeholders,
            BigDecimal averageActiveSplit,
            int artistsWithFiles,
            int auditLogEntries
    ) {
        public static ContractSummaryResponse fromDomain(ContractSummary s) {
            return new ContractSummaryResponse(
                    s.total(),
                    s.active(),
                    s.expired(),
                    s.placeholders(),
                    s.averageActiveSplit(),
                    s.artistsWithFiles(),
                    s.auditLogEntries()
            );
        }
    }

    public record EscalationResponse(
            Instant timestamp,
            String issueKind,
            String source,
            String detail,
            String action,
            boolean matchedRule,
            String message
    ) {
        public static EscalationResponse fromDomain(Escalation e) {
            return new EscalationResponse(
                    e.timestamp(),
                    e.issueKind(),
                    e.source(),
                    e.detail(),
                    e.action().name(),
                    e.matchedRule(),
                    e.message()
            );
        }
    }
}
