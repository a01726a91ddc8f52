package com.soundledger.domain.model.contract;

public enum ExpiryStatus {
    EXPIRED,
    EXPIRING_SOON
}
