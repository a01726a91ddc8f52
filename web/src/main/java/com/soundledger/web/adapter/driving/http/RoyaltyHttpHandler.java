package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.port.driving.RoyaltyServicePort;
import com.soundledger.web.adapter.driving.http.Request.IngestRevenueRequest;
import com.soundledger.web.adapter.driving.http.Request.ReconcileRequest;
import com.soundledger.web.adapter.driving.http.Request.ReleaseRequest;
import com.soundledger.web.adapter.driving.http.Request.RevenueRowRequest;
import com.soundledger.web.adapter.driving.http.Request.SetAdvanceRequest;
import com.soundledger.web.adapter.driving.http.Request.SetSplitRequest;
import com.soundledger.web.adapter.driving.http.Response.AdvanceBalanceResponse;
import com.soundledger.web.adapter.driving.http.Response.AuditEntryResponse;
import com.soundledger.web.adapter.driving.http.Response.ComputationResponse;
import com.soundledger.web.adapter.driving.http.Response.DiscrepancyResponse;
import com.soundledger.web.adapter.driving.http.Response.ExportResponse;
import com.soundledger.web.adapter.driving.http.Response.IngestResponse;
import com.soundledger.web.adapter.driving.http.Response.PayoutStatementResponse;
import jakarta.servlet.ServletException;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;

import static com.soundledger.web.adapter.driving.http.util.HttpUtil.optionalParam;
import static com.soundledger.web.adapter.driving.http.util.HttpUtil.parseAndValidateBody;
import static com.soundledger.web.adapter.driving.http.util.HttpUtil.parsePeriod;
import static org.springframework.http.HttpStatus.OK;

public final class RoyaltyHttpHandler {

    private final RoyaltyServicePort royaltyService;

    public RoyaltyHttpHandler(RoyaltyServicePort royaltyService) {
        this.royaltyService = royaltyService;
    }

    /**
     * GET /royalties/{period}?artist=...
     * period format: yyyy-Qn (e.g. 2025-Q4)
     */
    public ServerResponse calculate(ServerRequest request) {
        var period = parsePeriod(request.pathVariable("period"));
        var artist = optionalParam(request, "artist").orElse(null);

        var computation = royaltyService.calculate(period, artist);
        return ServerResponse.status(OK).body(ComputationResponse.fromDomain(period, computation));
    }

    public ServerResponse ingestRevenue(ServerRequest request) throws ServletException, IOException {
        var dto = parseAndValidateBody(request, IngestRevenueRequest.class);
        var records = dto.records().stream().map(RoyaltyHttpHandler::toDomain).toList();

        var ingested = royaltyService.ingestRevenue(records);
        return ServerResponse
                .status(HttpStatus.CREATED)
                .body(new IngestResponse(ingested));
    }

    public ServerResponse reconcile(ServerRequest request) throws ServletException, IOException {
        var period = parsePeriod(request.pathVariable("period"));
        var dto = parseAndValidateBody(request, ReconcileRequest.class);

        var discrepancies = royaltyService.reconcile(period, dto.actualPayouts());
        return ServerResponse.status(OK).body(discrepancies.stream().map(DiscrepancyResponse::fromDomain).toList());
    }

    public ServerResponse release(ServerRequest request) throws ServletException, IOException {
        var period = parsePeriod(request.pathVariable("period"));
        var dto = parseAndValidateBody(request, ReleaseRequest.class);

        var statements = royaltyService.release(period, dto.overridesOrEmpty());
        return ServerResponse.status(OK).body(statements.stream().map(PayoutStatementResponse::fromDomain).toList());
    }

    public ServerResponse settle(ServerRequest request) throws ServletException, IOException {
        var period = parsePeriod(request.pathVariable("period"));
        var dto = parseAndValidateBody(request, ReleaseRequest.class);

        var statements = royaltyService.settle(period, dto.overridesOrEmpty());
        return ServerResponse.status(OK).body(statements.stream().map(PayoutStatementResponse::fromDomain).toList());
    }

    public ServerResponse exportReports(ServerRequest request) {
        var period = parsePeriod(request.pathVariable("period"));

        var keys = royaltyService.exportReports(period);
        return ServerResponse
                .status(HttpStatus.CREATED)
                .body(new ExportResponse(period.label(), keys));
    }

    public ServerResponse setSplit(ServerRequest request) throws ServletException, IOException {
        var artist = request.pathVariable("artist");
        var dto = parseAndValidateBody(request, SetSplitRequest.class);

        var audit = royaltyService.setSplit(artist, dto.fraction(), dto.reason(), dto.actor());
        return ServerResponse.status(OK).body(AuditEntryResponse.fromDomain(audit));
    }

    public ServerResponse setAdvance(ServerRequest request) throws ServletException, IOException {
        var artist = request.pathVariable("artist");
        var dto = parseAndValidateBody(request, SetAdvanceRequest.class);

        royaltyService.setAdvance(artist, dto.balance());
        return ServerResponse.status(OK).body(AdvanceBalanceResponse.fromDomain(royaltyService.balance(artist)));
    }

    public ServerResponse advances(ServerRequest request) {
        var artist = optionalParam(request, "artist").orElse(null);

        var balances = royaltyService.advances(artist);
        return ServerResponse.status(OK).body(balances.stream().map(AdvanceBalanceResponse::fromDomain).toList());
    }

    public ServerResponse balance(ServerRequest request) {
        var balance = royaltyService.balance(request.pathVariable("artist"));
        return ServerResponse.status(OK).body(AdvanceBalanceResponse.fromDomain(balance));
    }

    private static RevenueRecord toDomain(RevenueRowRequest row) {
        return RevenueRecord.of(
                row.artist(),
                row.track(),
                row.platform(),
                row.country(),
                parsePeriod(row.period()),
                row.streams(),
                row.revenue()
        );
    }
}
