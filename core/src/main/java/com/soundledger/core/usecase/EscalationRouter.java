package com.soundledger.core.usecase;

import com.soundledger.domain.model.escalation.EscalationAction;
import com.soundledger.domain.model.escalation.EscalationRule;

import java.util.List;
import java.util.Optional;

import static com.soundledger.domain.model.escalation.SourceComponent.CONTRACT_MANAGER;
import static com.soundledger.domain.model.escalation.SourceComponent.DEVOPS;
import static com.soundledger.domain.model.escalation.SourceComponent.ROYALTY_ENGINE;

/**
 * Resolves an issue to an action using the first matching rule. Issues no rule matches go to an admin.
 */
public final class EscalationRouter {
    public static final EscalationAction DEFAULT_ACTION = EscalationAction.NOTIFY_ADMIN;

    public static final List<EscalationRule> DEFAULT_RULES = List.of(
            EscalationRule.of(ROYALTY_ENGINE, "error_in_calculation", EscalationAction.NOTIFY_ADMIN),
            EscalationRule.of(CONTRACT_MANAGER, "split_mismatch", EscalationAction.BLOCK),
            EscalationRule.of(DEVOPS, "deploy_failed", EscalationAction.NOTIFY_ADMIN)
    );

    private final List<EscalationRule> rules;

    public EscalationRouter() {
        this(DEFAULT_RULES);
    }

    public EscalationRouter(List<EscalationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public EscalationAction route(String issueKind, String source) {
        return match(issueKind, source)
                .map(EscalationRule::action)
                .orElse(DEFAULT_ACTION);
    }

    public Optional<EscalationRule> match(String issueKind, String source) {
        return rules
                .stream()
                .filter(r -> r.matches(issueKind, source))
                .findFirst();
    }

    public List<EscalationRule> rules() {
        return rules;
    }
}
