package com.soundledger.application.escalation;

import com.soundledger.domain.model.escalation.Escalation;
import com.soundledger.domain.port.driven.EscalationNotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers escalations to the application log. Chat and email delivery are not wired.
 */
public final class LoggingEscalationNotifier implements EscalationNotifierPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingEscalationNotifier.class);

    @Override
    public void deliver(Escalation escalation) {
        switch (escalation.action()) {
            case BLOCK -> log.error("[{}] {}", escalation.action().code(), escalation.message());
            case NOTIFY_ADMIN -> log.warn("[{}] {}", escalation.action().code(), escalation.message());
            case AUTO_RESOLVE -> log.info("[{}] {}", escalation.action().code(), escalation.message());
        }
    }
}
