package com.soundledger.domain.model.contract;

import java.time.LocalDate;

public record ContractExpiry(String artist, LocalDate expiryDate, long daysLeft, ExpiryStatus status) {
    public static ContractExpiry of(String artist, LocalDate expiryDate, long daysLeft) {
        return new ContractExpiry(
                artist,
                expiryDate,
                daysLeft,
                daysLeft <= 0 ? ExpiryStatus.EXPIRED : ExpiryStatus.EXPIRING_SOON
        );
    }
}
