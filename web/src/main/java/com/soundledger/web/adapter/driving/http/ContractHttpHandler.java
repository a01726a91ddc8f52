package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.port.driving.ContractServicePort;
import com.soundledger.web.adapter.driving.http.Request.AddContractRequest;
import com.soundledger.web.adapter.driving.http.Request.SetSplitRequest;
import com.soundledger.web.adapter.driving.http.Response.AuditEntryResponse;
import com.soundledger.web.adapter.driving.http.Response.ContractExpiryResponse;
import com.soundledger.web.adapter.driving.http.Response.ContractResponse;
import com.soundledger.web.adapter.driving.http.Response.ContractSummaryResponse;
import com.soundledger.web.adapter.driving.http.Response.SplitMismatchResponse;
import jakarta.servlet.ServletException;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;

import static com.soundledger.web.adapter.driving.http.util.HttpUtil.intParam;
import static com.soundledger.web.adapter.driving.http.util.HttpUtil.parseAndValidateBody;
import static org.springframework.http.HttpStatus.OK;

public final class ContractHttpHandler {

    private final ContractServicePort contractService;
    private final int defaultExpiryHorizonDays;

    public ContractHttpHandler(ContractServicePort contractService, int defaultExpiryHorizonDays) {
        this.contractService = contractService;
        this.defaultExpiryHorizonDays = defaultExpiryHorizonDays;
    }

    public ServerResponse addContract(ServerRequest request) throws ServletException, IOException {
        var dto = parseAndValidateBody(request, AddContractRequest.class);
        var created = contractService.addContract(ContractRecord.of(
                dto.artist(),
                dto.splitFraction(),
                dto.signedDate(),
                dto.expiryDate(),
                dto.filePath(),
                dto.fileType(),
                dto.status(),
                dto.notes()
        ));
        return ServerResponse
                .status(HttpStatus.CREATED)
                .body(ContractResponse.fromDomain(created));
    }

    public ServerResponse getContract(ServerRequest request) {
        var contract = contractService.getContract(request.pathVariable("artist"));
        return ServerResponse.status(OK).body(ContractResponse.fromDomain(contract));
    }

    public ServerResponse contracts(ServerRequest request) {
        return ServerResponse.status(OK).body(
                contractService.contracts().stream().map(ContractResponse::fromDomain).toList());
    }

    public ServerResponse updateSplit(ServerRequest request) throws ServletException, IOException {
        var artist = request.pathVariable("artist");
        var dto = parseAndValidateBody(request, SetSplitRequest.class);

        var audit = contractService.updateSplit(artist, dto.fraction(), dto.reason(), dto.actor());
        return ServerResponse.status(OK).body(AuditEntryResponse.fromDomain(audit));
    }

    public ServerResponse verifySplits(ServerRequest request) {
        return ServerResponse.status(OK).body(
                contractService.verifySplits().stream().map(SplitMismatchResponse::fromDomain).toList());
    }

    /**
     * GET /contracts/expirations?daysAhead=90
     */
    public ServerResponse expirations(ServerRequest request) {
        var daysAhead = intParam(request, "daysAhead", defaultExpiryHorizonDays);
        return ServerResponse.status(OK).body(
                contractService.checkExpirations(daysAhead).stream().map(ContractExpiryResponse::fromDomain).toList());
    }

    public ServerResponse summary(ServerRequest request) {
        return ServerResponse.status(OK).body(ContractSummaryResponse.fromDomain(contractService.summary()));
    }

    public ServerResponse auditLog(ServerRequest request) {
        return ServerResponse.status(OK).body(
                contractService.auditLog().stream().map(AuditEntryResponse::fromDomain).toList());
    }
}
