package com.soundledger.domain.model.royalty;

public enum AdvanceStatus {
    ACTIVE,
    CLEAR
}
