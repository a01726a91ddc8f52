package com.soundledger.domain.model.escalation;

/**
 * Names under which components raise escalations. Escalation rules are keyed by these.
 */
public final class SourceComponent {
    public static final String ROYALTY_ENGINE = "ROYALTY-ENGINE";
    public static final String CONTRACT_MANAGER = "CONTRACT-MGR";
    public static final String DEVOPS = "DEVOPS-BOT";

    private SourceComponent() {}
}
