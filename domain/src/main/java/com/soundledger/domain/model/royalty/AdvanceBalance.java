package com.soundledger.domain.model.royalty;

import java.math.BigDecimal;

public record AdvanceBalance(String artist, BigDecimal remainingBalance, AdvanceStatus status) {
    public static AdvanceBalance of(String artist, BigDecimal remainingBalance) {
        return new AdvanceBalance(
                artist,
                remainingBalance,
                remainingBalance.signum() > 0 ? AdvanceStatus.ACTIVE : AdvanceStatus.CLEAR
        );
    }
}
