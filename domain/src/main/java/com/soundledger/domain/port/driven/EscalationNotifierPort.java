package com.soundledger.domain.port.driven;

import com.soundledger.domain.model.escalation.Escalation;

@FunctionalInterface
public interface EscalationNotifierPort {
    void deliver(Escalation escalation);
}
