package com.soundledger.domain.model.reconciliation;

public enum DiscrepancyKind {
    MISSING_ACTUAL("missing_actual"),
    AMOUNT_MISMATCH("amount_mismatch");

    private final String code;

    DiscrepancyKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
