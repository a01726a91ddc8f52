package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.port.driving.EscalationPort;
import com.soundledger.web.adapter.driving.http.Request.EscalateRequest;
import com.soundledger.web.adapter.driving.http.Response.EscalationResponse;
import jakarta.servlet.ServletException;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;

import static com.soundledger.web.adapter.driving.http.util.HttpUtil.parseAndValidateBody;
import static org.springframework.http.HttpStatus.OK;

public final class EscalationHttpHandler {

    private final EscalationPort escalations;

    public EscalationHttpHandler(EscalationPort escalations) {
        this.escalations = escalations;
    }

    public ServerResponse escalate(ServerRequest request) throws ServletException, IOException {
        var dto = parseAndValidateBody(request, EscalateRequest.class);
        var escalation = escalations.escalate(dto.issueKind(), dto.source(), dto.detail());
        return ServerResponse
                .status(HttpStatus.CREATED)
                .body(EscalationResponse.fromDomain(escalation));
    }

    public ServerResponse decisions(ServerRequest request) {
        return ServerResponse.status(OK).body(
                escalations.decisions().stream().map(EscalationResponse::fromDomain).toList());
    }
}
