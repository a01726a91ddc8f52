package com.soundledger.domain.model.contract;

import java.math.BigDecimal;

public record ContractSummary(
        int total,
        int active,
        int expired,
        int placeholders,
        BigDecimal averageActiveSplit,
        int artistsWithFiles,
        int auditLogEntries
) {
}
