package com.soundledger.domain.model.escalation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;

import static com.soundledger.domain.model.DomainValidator.assertValid;

/**
 * Matches when the issue comes from {@code source} and its kind contains {@code condition}, ignoring case.
 */
public record EscalationRule(
        @NotBlank(message = "Escalation rule source is required")
        String source,

        @NotBlank(message = "Escalation rule condition is required")
        String condition,

        @NotNull(message = "Escalation rule action is required")
        EscalationAction action
) {
    public static EscalationRule of(String source, String condition, EscalationAction action) {
        return assertValid(new EscalationRule(source, condition, action));
    }

    public boolean matches(String issueKind, String sourceComponent) {
        if (issueKind == null || !source.equals(sourceComponent)) return false;

        return issueKind.toLowerCase(Locale.ROOT).contains(condition.toLowerCase(Locale.ROOT));
    }
}
