package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.model.escalation.Escalation;
import com.soundledger.domain.model.escalation.EscalationAction;
import com.soundledger.domain.port.driving.EscalationPort;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.SoftAssertions.assertSoftly;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class EscalationHttpHandlerTest extends AbstractHttpTest {

    private final EscalationPort escalations = mock(EscalationPort.class);
    private final EscalationHttpHandler handler = new EscalationHttpHandler(escalations);
    private final HttpErrorFilter errorFilter = new HttpErrorFilter();

    private final Escalation blocked = new Escalation(
            Instant.parse("2025-10-01T00:00:00Z"),
            "split_mismatch",
            "CONTRACT-MGR",
            "Nova",
            EscalationAction.BLOCK,
            true
    );

    @Test
    void escalate_returns201_with_action() throws Exception {
        when(escalations.escalate("split_mismatch", "CONTRACT-MGR", "Nova")).thenReturn(blocked);

        var req = postJson("/escalations", """
                {"issueKind":"split_mismatch","source":"CONTRACT-MGR","detail":"Nova"}
                """);
        var res = errorFilter.filter(req, handler::escalate);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(201);
            s.assertThat(body).contains("\"action\":\"BLOCK\"");
            s.assertThat(body).contains("\"matchedRule\":true");
        });
    }

    @Test
    void escalate_without_source_returns400() throws Exception {
        var req = postJson("/escalations", """
                {"issueKind":"split_mismatch"}
                """);
        var res = errorFilter.filter(req, handler::escalate);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.check(() -> verifyNoInteractions(escalations));
        });
    }

    @Test
    void decisions_lists_log() throws Exception {
        when(escalations.decisions()).thenReturn(List.of(blocked));

        var body = writeToString(errorFilter.filter(getWithPathVars("/escalations", Map.of()), handler::decisions));

        assertSoftly(s -> s.assertThat(body).contains("\"issueKind\":\"split_mismatch\""));
    }
}
