package com.soundledger.domain.model.contract;

public enum SplitMismatchKind {
    MISSING_IN_REGISTRY("missing_in_registry", false),
    VALUE_MISMATCH("value_mismatch", true);

    private final String code;
    private final boolean blocking;

    SplitMismatchKind(String code, boolean blocking) {
        this.code = code;
        this.blocking = blocking;
    }

    public String code() {
        return code;
    }

    public boolean isBlocking() {
        return blocking;
    }
}
