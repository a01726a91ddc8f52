package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.error.ConfigurationMissingException;
import com.soundledger.domain.error.OutOfRangeException;
import com.soundledger.domain.error.PersistenceException;
import com.soundledger.domain.model.reconciliation.DiscrepancyRecord;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.AdvanceBalance;
import com.soundledger.domain.model.royalty.AuditEntry;
import com.soundledger.domain.model.royalty.Computation;
import com.soundledger.domain.model.royalty.MissingSplitWarning;
import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.model.royalty.PayoutStatement;
import com.soundledger.domain.model.royalty.ReleaseStatus;
import com.soundledger.domain.model.royalty.RevenueRecord;
import com.soundledger.domain.port.driving.RoyaltyServicePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.function.HandlerFilterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.SoftAssertions.assertSoftly;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class RoyaltyHttpHandlerTest extends AbstractHttpTest {

    private final RoyaltyServicePort royaltyService = mock(RoyaltyServicePort.class);
    private final AccountingPeriod period = AccountingPeriod.of(2025, 4);

    private RoyaltyHttpHandler handler;
    private HandlerFilterFunction<ServerResponse, ServerResponse> errorFilter;

    @BeforeEach
    void setUp() {
        handler = new RoyaltyHttpHandler(royaltyService);
        errorFilter = new HttpErrorFilter();
    }

    private Payout payout() {
        return Payout.of(
                "Nova",
                period,
                new BigDecimal("10000.00"),
                new BigDecimal("0.70"),
                new BigDecimal("7000.00"),
                new BigDecimal("7000.00"),
                new BigDecimal("0.00"),
                2,
                1000L
        );
    }

    @Test
    void calculate_ok_returns200_with_payouts_and_warnings() throws Exception {
        when(royaltyService.calculate(period, null)).thenReturn(new Computation(
                List.of(payout()),
                List.of(new MissingSplitWarning("Echo", period, new BigDecimal("50")))
        ));

        var req = getWithPathVars("/royalties/{period}", Map.of("period", "2025-Q4"));
        var res = errorFilter.filter(req, handler::calculate);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"period\":\"2025-Q4\"");
            s.assertThat(body).contains("\"artist\":\"Nova\"");
            s.assertThat(body).contains("\"artistShare\":7000.00");
            s.assertThat(body).contains("\"advanceDeducted\":7000.00");
            s.assertThat(body).contains("\"netPayout\":0.00");
            s.assertThat(body).contains("\"tracks\":2");
            s.assertThat(body).contains("\"warnings\":[{\"artist\":\"Echo\"");
        });
    }

    @Test
    void calculate_passes_artist_filter() throws Exception {
        when(royaltyService.calculate(period, "Nova")).thenReturn(new Computation(List.of(payout()), List.of()));

        var req = getWithPathVars("/royalties/{period}", Map.of("period", "Q4 2025"), Map.of("artist", "Nova"));
        var res = errorFilter.filter(req, handler::calculate);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.check(() -> verify(royaltyService).calculate(period, "Nova"));
        });
    }

    @Test
    void calculate_invalid_period_returns400_via_filter() throws Exception {
        var req = getWithPathVars("/royalties/{period}", Map.of("period", "2025-13"));
        var res = errorFilter.filter(req, handler::calculate);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.assertThat(body).contains("\"error\":\"Invalid request:");
            s.check(() -> verifyNoInteractions(royaltyService));
        });
    }

    @Test
    void calculate_without_revenue_source_returns503_via_filter() throws Exception {
        when(royaltyService.calculate(period, null))
                .thenThrow(new ConfigurationMissingException("Revenue source is not configured"));

        var req = getWithPathVars("/royalties/{period}", Map.of("period", "2025-Q4"));
        var res = errorFilter.filter(req, handler::calculate);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(503);
            s.assertThat(body).contains("Revenue source is not configured");
        });
    }

    @Test
    void calculate_persistence_failure_returns500_via_filter() throws Exception {
        when(royaltyService.calculate(period, null))
                .thenThrow(new PersistenceException("DB error during revenue fetch for 2025-Q4", new RuntimeException()));

        var req = getWithPathVars("/royalties/{period}", Map.of("period", "2025-Q4"));
        var res = errorFilter.filter(req, handler::calculate);

        assertSoftly(s -> s.assertThat(status(res)).isEqualTo(500));
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingestRevenue_returns201_and_maps_rows() throws Exception {
        when(royaltyService.ingestRevenue(any())).thenReturn(2);

        var req = postJson("/revenue", """
                {"records":[
                  {"artist":"Nova","track":"t1","platform":"spotify","country":"NL","period":"2025-Q4","streams":10,"revenue":1.25},
                  {"artist":"Echo","platform":"apple","country":"DE","period":"Q4 2025","streams":0,"revenue":0}
                ]}
                """);
        var res = errorFilter.filter(req, handler::ingestRevenue);
        var body = writeToString(res);

        var captor = ArgumentCaptor.forClass(List.class);
        verify(royaltyService).ingestRevenue(captor.capture());
        List<RevenueRecord> rows = captor.getValue();

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(201);
            s.assertThat(body).contains("\"ingested\":2");
            s.assertThat(rows).hasSize(2);
            s.assertThat(rows.get(0).getRevenue()).isEqualByComparingTo("1.25");
            s.assertThat(rows.get(1).getPeriod()).isEqualTo(period);
            s.assertThat(rows.get(1).getTrack()).isEmpty();
        });
    }

    @Test
    void ingestRevenue_negative_revenue_returns400() throws Exception {
        var req = postJson("/revenue", """
                {"records":[{"artist":"Nova","platform":"spotify","country":"NL","period":"2025-Q4","streams":1,"revenue":-1}]}
                """);
        var res = errorFilter.filter(req, handler::ingestRevenue);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.assertThat(body).contains("Revenue amount cannot be negative");
            s.check(() -> verifyNoInteractions(royaltyService));
        });
    }

    @Test
    void ingestRevenue_malformed_json_returns400() throws Exception {
        var req = postJson("/revenue", "{\"records\": [");
        var res = errorFilter.filter(req, handler::ingestRevenue);

        assertSoftly(s -> s.assertThat(status(res)).isEqualTo(400));
    }

    @Test
    void reconcile_returns_discrepancies() throws Exception {
        var actual = Map.of("Nova", new BigDecimal("300.01"));
        when(royaltyService.reconcile(period, actual)).thenReturn(List.of(
                DiscrepancyRecord.amountMismatch("Nova", period, new BigDecimal("300.00"), new BigDecimal("300.01"))
        ));

        var req = postJsonWithPathVars(
                "/royalties/{period}/reconciliation",
                Map.of("period", "2025-Q4"),
                """
                {"actualPayouts":{"Nova":300.01}}
                """
        );
        var res = errorFilter.filter(req, handler::reconcile);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"kind\":\"AMOUNT_MISMATCH\"");
            s.assertThat(body).contains("\"difference\":0.01");
        });
    }

    @Test
    void release_passes_overrides_and_returns_statuses() throws Exception {
        when(royaltyService.release(period, Set.of("Nova")))
                .thenReturn(List.of(new PayoutStatement(payout(), ReleaseStatus.OVERRIDDEN)));

        var req = postJsonWithPathVars("/royalties/{period}/release", Map.of("period", "2025-Q4"), """
                {"overrides":["Nova"]}
                """);
        var res = errorFilter.filter(req, handler::release);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"status\":\"OVERRIDDEN\"");
            s.assertThat(body).contains("\"releasable\":true");
        });
    }

    @Test
    void settle_without_overrides_uses_empty_set() throws Exception {
        when(royaltyService.settle(period, Set.of()))
                .thenReturn(List.of(new PayoutStatement(payout(), ReleaseStatus.BLOCKED)));

        var req = postJsonWithPathVars("/royalties/{period}/settlement", Map.of("period", "2025-Q4"), "{}");
        var res = errorFilter.filter(req, handler::settle);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"status\":\"BLOCKED\"");
            s.assertThat(body).contains("\"releasable\":false");
        });
    }

    @Test
    void setSplit_returns_audit_entry() throws Exception {
        var audit = AuditEntry.of(
                Instant.parse("2025-10-01T00:00:00Z"),
                "Nova",
                new BigDecimal("0.65"),
                new BigDecimal("0.70"),
                "renegotiated",
                "alex"
        );
        when(royaltyService.setSplit("Nova", new BigDecimal("0.70"), "renegotiated", "alex")).thenReturn(audit);

        var req = putJsonWithPathVars("/splits/{artist}", Map.of("artist", "Nova"), """
                {"fraction":0.70,"reason":"renegotiated","actor":"alex"}
                """);
        var res = errorFilter.filter(req, handler::setSplit);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"oldFraction\":0.65");
            s.assertThat(body).contains("\"timestamp\":\"2025-10-01T00:00:00Z\"");
        });
    }

    @Test
    void setSplit_out_of_range_returns400() throws Exception {
        when(royaltyService.setSplit("Nova", new BigDecimal("1.5"), "typo", "alex"))
                .thenThrow(new OutOfRangeException("Invalid share fraction 1.5 for Nova. Must be between 0 and 1."));

        var req = putJsonWithPathVars("/splits/{artist}", Map.of("artist", "Nova"), """
                {"fraction":1.5,"reason":"typo","actor":"alex"}
                """);
        var res = errorFilter.filter(req, handler::setSplit);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.assertThat(body).contains("Must be between 0 and 1");
        });
    }

    @Test
    void setSplit_without_reason_returns400_without_calling_service() throws Exception {
        var req = putJsonWithPathVars("/splits/{artist}", Map.of("artist", "Nova"), """
                {"fraction":0.5,"actor":"alex"}
                """);
        var res = errorFilter.filter(req, handler::setSplit);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(400);
            s.check(() -> verifyNoInteractions(royaltyService));
        });
    }

    @Test
    void advances_and_balance_return_balances() throws Exception {
        when(royaltyService.advances(null)).thenReturn(List.of(AdvanceBalance.of("Nova", new BigDecimal("500"))));
        when(royaltyService.balance("Echo")).thenReturn(AdvanceBalance.of("Echo", BigDecimal.ZERO));

        var listRes = errorFilter.filter(getWithPathVars("/advances", Map.of()), handler::advances);
        var oneRes = errorFilter.filter(getWithPathVars("/advances/{artist}", Map.of("artist", "Echo")), handler::balance);

        var listBody = writeToString(listRes);
        var oneBody = writeToString(oneRes);

        assertSoftly(s -> {
            s.assertThat(listBody).contains("\"artist\":\"Nova\"").contains("\"status\":\"ACTIVE\"");
            s.assertThat(oneBody).contains("\"artist\":\"Echo\"").contains("\"status\":\"CLEAR\"");
        });
    }

    @Test
    void setAdvance_returns_new_balance() throws Exception {
        when(royaltyService.balance("Nova")).thenReturn(AdvanceBalance.of("Nova", new BigDecimal("7500")));

        var req = putJsonWithPathVars("/advances/{artist}", Map.of("artist", "Nova"), """
                {"balance":7500}
                """);
        var res = errorFilter.filter(req, handler::setAdvance);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(200);
            s.assertThat(body).contains("\"remainingBalance\":7500");
            s.check(() -> verify(royaltyService).setAdvance("Nova", new BigDecimal("7500")));
        });
    }

    @Test
    void exportReports_returns201_with_object_keys() throws Exception {
        when(royaltyService.exportReports(period)).thenReturn(List.of("2025-Q4/royalty_Nova_2025-Q4.csv"));

        var req = postJsonWithPathVars("/royalties/{period}/reports", Map.of("period", "2025-Q4"), "{}");
        var res = errorFilter.filter(req, handler::exportReports);
        var body = writeToString(res);

        assertSoftly(s -> {
            s.assertThat(status(res)).isEqualTo(201);
            s.assertThat(body).contains("royalty_Nova_2025-Q4.csv");
        });
    }
}
