package com.soundledger.domain.model.escalation;

import java.time.Instant;

/**
 * A routed issue. {@code matchedRule} is false when no rule applied and the default action was used.
 */
public record Escalation(
        Instant timestamp,
        String issueKind,
        String source,
        String detail,
        EscalationAction action,
        boolean matchedRule
) {
    public String message() {
        var prefix = matchedRule ? "Escalation" : "Unmatched escalation";
        return "%s from %s: %s (%s)".formatted(prefix, source, issueKind, detail);
    }
}
