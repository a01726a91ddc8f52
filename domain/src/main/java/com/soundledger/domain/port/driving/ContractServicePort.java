package com.soundledger.domain.port.driving;

import com.soundledger.domain.model.contract.ContractExpiry;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.model.contract.ContractSummary;
import com.soundledger.domain.model.contract.SplitMismatch;
import com.soundledger.domain.model.royalty.AuditEntry;

import java.math.BigDecimal;
import java.util.List;

public interface ContractServicePort {
    ContractRecord addContract(ContractRecord contract);
    ContractRecord getContract(String artist);
    List<ContractRecord> contracts();
    AuditEntry updateSplit(String artist, BigDecimal fraction, String reason, String actor);
    List<SplitMismatch> verifySplits();
    List<ContractExpiry> checkExpirations(int daysAhead);
    ContractSummary summary();
    List<AuditEntry> auditLog();
}
