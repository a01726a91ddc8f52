package com.soundledger.application;

import com.soundledger.application.escalation.LoggingEscalationNotifier;
import com.soundledger.application.file.ReportConfigProperties;
import com.soundledger.application.royalty.RoyaltyConfigProperties;
import com.soundledger.application.royalty.RoyaltyConfigProperties.EscalationRuleConfig;
import com.soundledger.core.usecase.ContractServiceImpl;
import com.soundledger.core.usecase.EscalationRouter;
import com.soundledger.core.usecase.EscalationServiceImpl;
import com.soundledger.core.usecase.PayoutReportExporter;
import com.soundledger.core.usecase.RoyaltyServiceImpl;
import com.soundledger.data.adapter.driven.adapter.ContractRegistryAdapter;
import com.soundledger.data.adapter.driven.adapter.RevenueSourceAdapter;
import com.soundledger.data.adapter.driven.jpa.ContractJpaRepository;
import com.soundledger.data.adapter.driven.jpa.RevenueRecordJpaRepository;
import com.soundledger.domain.model.royalty.AdvanceLedger;
import com.soundledger.domain.model.royalty.ShareTable;
import com.soundledger.domain.port.driven.ContractRegistryPort;
import com.soundledger.domain.port.driven.EscalationNotifierPort;
import com.soundledger.domain.port.driven.RevenueSourcePort;
import com.soundledger.domain.port.driving.ContractServicePort;
import com.soundledger.domain.port.driving.EscalationPort;
import com.soundledger.domain.port.driving.RoyaltyServicePort;
import com.soundledger.web.adapter.driving.http.ContractHttpHandler;
import com.soundledger.web.adapter.driving.http.EscalationHttpHandler;
import com.soundledger.web.adapter.driving.http.HttpErrorFilter;
import com.soundledger.web.adapter.driving.http.RoyaltyHttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.HandlerFilterFunction;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        RoyaltyConfigProperties.class,
        ReportConfigProperties.class
})
public class BeansConfig {

    private static final Logger log = LoggerFactory.getLogger(BeansConfig.class);

    static final String SEED_REASON = "seeded from configuration";
    static final String SEED_ACTOR = "system";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShareTable shareTable(RoyaltyConfigProperties royaltyConfig, Clock clock) {
        var table = new ShareTable(clock);
        royaltyConfig.sharesOrEmpty().forEach(share ->
                table.set(share.artist(), share.fraction(), share.provenance(), SEED_REASON, SEED_ACTOR));
        log.info("Share table seeded with {} artists", table.size());
        return table;
    }

    @Bean
    public AdvanceLedger advanceLedger(RoyaltyConfigProperties royaltyConfig) {
        var ledger = new AdvanceLedger();
        royaltyConfig.advancesOrEmpty().forEach(advance -> ledger.set(advance.artist(), advance.balance()));
        return ledger;
    }

    @Bean
    public EscalationRouter escalationRouter(RoyaltyConfigProperties royaltyConfig) {
        var rules = royaltyConfig.escalationRulesOrEmpty();
        if (rules.isEmpty()) return new EscalationRouter();

        return new EscalationRouter(rules.stream().map(EscalationRuleConfig::toDomain).toList());
    }

    @Bean
    public EscalationNotifierPort escalationNotifier() {
        return new LoggingEscalationNotifier();
    }

    @Bean
    public EscalationPort escalationService(
            EscalationRouter escalationRouter,
            EscalationNotifierPort escalationNotifier,
            Clock clock
    ) {
        return new EscalationServiceImpl(escalationRouter, escalationNotifier, clock);
    }

    @Bean
    public RevenueSourceAdapter revenueSourceAdapter(RevenueRecordJpaRepository jpaRepository) {
        return new RevenueSourceAdapter(jpaRepository);
    }

    @Bean
    public ContractRegistryAdapter contractRegistryAdapter(ContractJpaRepository jpaRepository) {
        return new ContractRegistryAdapter(jpaRepository);
    }

    @Bean
    public RoyaltyServicePort royaltyServicePort(
            RevenueSourcePort revenueSourcePort,
            ContractRegistryPort contractRegistryPort,
            EscalationPort escalationPort,
            ShareTable shareTable,
            AdvanceLedger advanceLedger,
            ObjectProvider<PayoutReportExporter> reportExporter
    ) {
        return new RoyaltyServiceImpl(
                revenueSourcePort,
                contractRegistryPort,
                escalationPort,
                shareTable,
                advanceLedger,
                reportExporter.getIfAvailable()
        );
    }

    @Bean
    public ContractServicePort contractServicePort(
            ContractRegistryPort contractRegistryPort,
            ShareTable shareTable,
            EscalationPort escalationPort,
            Clock clock
    ) {
        return new ContractServiceImpl(contractRegistryPort, shareTable, escalationPort, clock);
    }

    @Bean
    public RoyaltyHttpHandler royaltyHttpHandler(RoyaltyServicePort royaltyServicePort) {
        return new RoyaltyHttpHandler(royaltyServicePort);
    }

    @Bean
    public ContractHttpHandler contractHttpHandler(
            ContractServicePort contractServicePort,
            RoyaltyConfigProperties royaltyConfig
    ) {
        return new ContractHttpHandler(contractServicePort, royaltyConfig.expiryHorizonDays());
    }

    @Bean
    public EscalationHttpHandler escalationHttpHandler(EscalationPort escalationPort) {
        return new EscalationHttpHandler(escalationPort);
    }

    @Bean
    public HandlerFilterFunction<ServerResponse, ServerResponse> globalHttpErrorFilter() {
        return new HttpErrorFilter();
    }

    @Bean
    public RouterFunction<ServerResponse> routes(RoyaltyHttpHandler royaltyHandler,
                                                 ContractHttpHandler contractHandler,
                                                 EscalationHttpHandler escalationHandler,
                                                 HandlerFilterFunction<ServerResponse, ServerResponse> errorFilter) {
        return RouterFunctions.route()
                .POST("/revenue", royaltyHandler::ingestRevenue)
                .GET("/royalties/{period}", royaltyHandler::calculate)
                .POST("/royalties/{period}/reconciliation", royaltyHandler::reconcile)
                .POST("/royalties/{period}/release", royaltyHandler::release)
                .POST("/royalties/{period}/settlement", royaltyHandler::settle)
                .POST("/royalties/{period}/reports", royaltyHandler::exportReports)
                .PUT("/splits/{artist}", royaltyHandler::setSplit)
                .GET("/advances", royaltyHandler::advances)
                .GET("/advances/{artist}", royaltyHandler::balance)
                .PUT("/advances/{artist}", royaltyHandler::setAdvance)
                .POST("/contracts", contractHandler::addContract)
                .GET("/contracts", contractHandler::contracts)
                .GET("/contracts/summary", contractHandler::summary)
                .GET("/contracts/expirations", contractHandler::expirations)
                .GET("/contracts/audit-log", contractHandler::auditLog)
                .POST("/contracts/verification", contractHandler::verifySplits)
                .GET("/contracts/{artist}", contractHandler::getContract)
                .PUT("/contracts/{artist}/split", contractHandler::updateSplit)
                .POST("/escalations", escalationHandler::escalate)
                .GET("/escalations", escalationHandler::decisions)
                .filter(errorFilter)
                .build();
    }
}
