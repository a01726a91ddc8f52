package com.soundledger.application.royalty;

import com.soundledger.domain.model.escalation.EscalationAction;
import com.soundledger.domain.model.escalation.EscalationRule;
import com.soundledger.domain.model.royalty.ShareProvenance;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Seed data for the in-memory share table and advance ledger, plus escalation routing.
 * Without any {@code escalation-rules} the built-in routing table applies.
 */
@Validated
@ConfigurationProperties(prefix = "royalty")
public record RoyaltyConfigProperties(
        List<@Valid ShareConfig> shares,
        List<@Valid AdvanceConfig> advances,
        List<@Valid EscalationRuleConfig> escalationRules,

        @Min(value = 0, message = "royalty.expiry-horizon-days must be >= 0")
        Integer expiryHorizonDays
) {
    public static final int DEFAULT_EXPIRY_HORIZON_DAYS = 90;

    public RoyaltyConfigProperties {
        expiryHorizonDays = expiryHorizonDays == null ? DEFAULT_EXPIRY_HORIZON_DAYS : expiryHorizonDays;
    }

    public List<ShareConfig> sharesOrEmpty() {
        return shares == null ? List.of() : shares;
    }

    public List<AdvanceConfig> advancesOrEmpty() {
        return advances == null ? List.of() : advances;
    }

    public List<EscalationRuleConfig> escalationRulesOrEmpty() {
        return escalationRules == null ? List.of() : escalationRules;
    }

    @AssertTrue(message = "royalty.shares[] must not list the same artist twice")
    public boolean isSharesUnique() {
        return isUnique(sharesOrEmpty(), ShareConfig::artist);
    }

    @AssertTrue(message = "royalty.advances[] must not list the same artist twice")
    public boolean isAdvancesUnique() {
        return isUnique(advancesOrEmpty(), AdvanceConfig::artist);
    }

    private static <T> boolean isUnique(List<T> items, Function<T, String> key) {
        return items.stream().map(key).distinct().count() == items.size();
    }

    public record ShareConfig(
            @NotBlank(message = "royalty.shares[].artist is required")
            String artist,

            @NotNull(message = "royalty.shares[].fraction is required")
            @DecimalMin(value = "0", message = "royalty.shares[].fraction must be >= 0")
            @DecimalMax(value = "1", message = "royalty.shares[].fraction must be <= 1")
            BigDecimal fraction,

            ShareProvenance provenance
    ) {
        public ShareConfig {
            provenance = provenance == null ? ShareProvenance.CONTRACT : provenance;
        }
    }

    public record AdvanceConfig(
            @NotBlank(message = "royalty.advances[].artist is required")
            String artist,

            @NotNull(message = "royalty.advances[].balance is required")
            @DecimalMin(value = "0", message = "royalty.advances[].balance must be >= 0")
            BigDecimal balance
    ) {
    }

    public record EscalationRuleConfig(
            @NotBlank(message = "royalty.escalation-rules[].source is required")
            String source,

            @NotBlank(message = "royalty.escalation-rules[].condition is required")
            String condition,

            @NotNull(message = "royalty.escalation-rules[].action is required")
            EscalationAction action
    ) {
        public EscalationRule toDomain() {
            return EscalationRule.of(source, condition, action);
        }
    }
}
