package com.soundledger.domain.port.driving;

import com.soundledger.domain.model.escalation.Escalation;

import java.util.List;

public interface EscalationPort {
    Escalation escalate(String issueKind, String source, String detail);
    List<Escalation> decisions();
}
