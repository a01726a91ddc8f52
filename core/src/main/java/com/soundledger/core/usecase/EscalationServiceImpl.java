package com.soundledger.core.usecase;

import com.soundledger.domain.model.escalation.Escalation;
import com.soundledger.domain.model.escalation.EscalationAction;
import com.soundledger.domain.model.escalation.EscalationRule;
import com.soundledger.domain.port.driven.EscalationNotifierPort;
import com.soundledger.domain.port.driving.EscalationPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class EscalationServiceImpl implements EscalationPort {
    private static final Logger log = LoggerFactory.getLogger(EscalationServiceImpl.class);

    private final EscalationRouter router;
    private final EscalationNotifierPort notifier;
    private final Clock clock;
    private final List<Escalation> decisionLog = new CopyOnWriteArrayList<>();

    public EscalationServiceImpl(EscalationRouter router, EscalationNotifierPort notifier, Clock clock) {
        this.router = router;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Routes the issue and records the decision. The decision is logged before delivery,
     * so a failing notifier never loses it.
     */
    @Override
    public Escalation escalate(String issueKind, String source, String detail) {
        var rule = router.match(issueKind, source);
        var escalation = new Escalation(
                clock.instant(),
                issueKind,
                source,
                detail == null ? "" : detail,
                rule.map(EscalationRule::action).orElse(EscalationRouter.DEFAULT_ACTION),
                rule.isPresent()
        );

        decisionLog.add(escalation);

        if (escalation.action() == EscalationAction.BLOCK) {
            log.error("{} -> {}", escalation.message(), escalation.action().code());
        } else {
            log.warn("{} -> {}", escalation.message(), escalation.action().code());
        }

        try {
            notifier.deliver(escalation);
        } catch (RuntimeException e) {
            log.error("Delivering escalation {} from {} failed", issueKind, source, e);
        }

        return escalation;
    }

    @Override
    public List<Escalation> decisions() {
        return List.copyOf(decisionLog);
    }
}
