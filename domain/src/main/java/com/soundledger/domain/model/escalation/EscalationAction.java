package com.soundledger.domain.model.escalation;

public enum EscalationAction {
    NOTIFY_ADMIN("notify_admin"),
    AUTO_RESOLVE("auto_resolve"),
    BLOCK("block");

    private final String code;

    EscalationAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
