package com.soundledger.domain.model.contract;

public enum ContractStatus {
    ACTIVE,
    EXPIRED,
    PLACEHOLDER
}
