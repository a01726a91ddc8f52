package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.error.NotFoundException;
import com.soundledger.domain.model.contract.ContractExpiry;
import com.soundledger.domain.model.contract.ContractFileType;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.model.contract.ContractStatus;
import com.soundledger.domain.model.contract.ContractSummary;
import com.soundledger.domain.model.contract.SplitMismatch;
import com.soundledger.domain.port.driving.ContractServicePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.function.HandlerFilterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.SoftAssertions.assertSoftly;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class ContractHttpHandlerTest extends AbstractHttpTest {

    private final ContractServicePort contractService = mock(ContractServicePort.class);

    private ContractHttpHandler handler;
    private HandlerFilterFunction<ServerResponse, ServerResponse> errorFilter;

    @BeforeEach
    void setUp() {
        handler = new ContractHttpHandler(contractService, 90);
        errorFilter = new HttpErrorFilter();
    }

    @Test
    void addContract_returns201_with_defaults_applied() throws Exception {
        when(contractService.addContract(any(ContractRecord.class))).thenAnswer(i -> i.getArgument(0));

        var req = postJson("/contracts", """
                {"artist":"Nova","splitFraction":0.70,"expiryDate":"2027-01-31"}
                """);
        var res = errorFilter.filter(req, handler::addContract);
        var body = writeToString(res);

        var captor = ArgumentCaptor.forClass(ContractRecord.class);
        verify(contractService).addContract(captor.capture());

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(201);
            s.assertThat(body).contains("\"artist\":\"Nova\"");
            s.assertThat(body).contains("\"expiryDate\":\"2027-01-31\"");
            s.assertThat(body).contains("\"status\":\"ACTIVE\"");
            s.assertThat(captor.getValue().getFileType()).isEqualTo(ContractFileType.PDF);
        });
    }

    @Test
    void addContract_split_above_one_returns400() throws Exception {
        var req = postJson("/contracts", """
                {"artist":"Nova","splitFraction":1.70}
                """);
        var res = errorFilter.filter(req, handler::addContract);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.assertThat(body).contains("cannot be above 1");
            s.check(() -> verifyNoInteractions(contractService));
        });
    }

    @Test
    void getContract_unknown_returns404() throws Exception {
        when(contractService.getContract("Ghost")).thenThrow(new NotFoundException("No contract for artist Ghost"));

        var req = getWithPathVars("/contracts/{artist}", Map.of("artist", "Ghost"));
        var res = errorFilter.filter(req, handler::getContract);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(404);
            s.assertThat(body).contains("\"error\":\"Invalid resource identifier:");
        });
    }

    @Test
    void verifySplits_lists_mismatches() throws Exception {
        when(contractService.verifySplits()).thenReturn(List.of(
                SplitMismatch.valueMismatch("Nova", new BigDecimal("0.70"), new BigDecimal("0.65")),
                SplitMismatch.missingInRegistry("Echo", new BigDecimal("0.80"))
        ));

        var res = errorFilter.filter(postJson("/contracts/verification", "{}"), handler::verifySplits);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"kind\":\"VALUE_MISMATCH\",\"blocking\":true");
            s.assertThat(body).contains("\"kind\":\"MISSING_IN_REGISTRY\",\"blocking\":false");
        });
    }

    @Test
    void expirations_uses_default_horizon_and_query_override() throws Exception {
        when(contractService.checkExpirations(90)).thenReturn(List.of(
                ContractExpiry.of("Nova", LocalDate.of(2025, 11, 30), 60)
        ));
        when(contractService.checkExpirations(30)).thenReturn(List.of());

        var defaultRes = errorFilter.filter(getWithPathVars("/contracts/expirations", Map.of()), handler::expirations);
        var customRes = errorFilter.filter(
                getWithPathVars("/contracts/expirations", Map.of(), Map.of("daysAhead", "30")),
                handler::expirations
        );
        var badRes = errorFilter.filter(
                getWithPathVars("/contracts/expirations", Map.of(), Map.of("daysAhead", "soon")),
                handler::expirations
        );

        var defaultBody = writeToString(defaultRes);

        assertSoftly(s -> {
            s.assertThat(defaultBody).contains("\"status\":\"EXPIRING_SOON\"").contains("\"daysLeft\":60");
            s.assertThat(status(customRes)).isEqualTo(200);
            s.assertThat(status(badRes)).isEqualTo(400);
        });
    }

    @Test
    void summary_and_contracts_are_listed() throws Exception {
        when(contractService.summary()).thenReturn(new ContractSummary(3, 2, 1, 0, new BigDecimal("0.7500"), 1, 4));
        when(contractService.contracts()).thenReturn(List.of(
                ContractRecord.of("Nova", new BigDecimal("0.7"), null, null, null, ContractFileType.DOCX, ContractStatus.EXPIRED, "")
        ));

        var summaryBody = writeToString(errorFilter.filter(getWithPathVars("/contracts/summary", Map.of()), handler::summary));
        var listBody = writeToString(errorFilter.filter(getWithPathVars("/contracts", Map.of()), handler::contracts));

        assertSoftly(s -> {
            s.assertThat(summaryBody).contains("\"averageActiveSplit\":0.7500").contains("\"auditLogEntries\":4");
            s.assertThat(listBody).contains("\"fileType\":\"DOCX\"").contains("\"status\":\"EXPIRED\"");
        });
    }
}
