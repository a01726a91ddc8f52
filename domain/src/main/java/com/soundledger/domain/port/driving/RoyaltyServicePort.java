package com.soundledger.domain.port.driving;

import com.soundledger.domain.model.reconciliation.DiscrepancyRecord;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceBalance;
import com.soundledger.domain.model.royalty.AuditEntry;
import com.soundledger.domain.model.royalty.Computation;
import com.soundledger.domain.model.royalty.PayoutStatement;
import com.soundledger.domain.model.royalty.RevenueRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface RoyaltyServicePort {
    Computation calculate(AccountingPeriod period);
    Computation calculate(AccountingPeriod period, String artist);
    int ingestRevenue(List<RevenueRecord> records);
    List<DiscrepancyRecord> reconcile(AccountingPeriod period, Map<String, BigDecimal> actualPayouts);
    List<PayoutStatement> release(AccountingPeriod period, Set<String> overrides);
    List<PayoutStatement> settle(AccountingPeriod period, Set<String> overrides);
    AuditEntry setSplit(String artist, BigDecimal fraction, String reason, String actor);
    void setAdvance(String artist, BigDecimal balance);
    List<AdvanceBalance> advances(String artist);
    AdvanceBalance balance(String artist);
    List<String> exportReports(AccountingPeriod period);
}
