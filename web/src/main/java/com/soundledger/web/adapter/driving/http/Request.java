package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.model.contract.ContractFileType;
import com.soundledger.domain.model.contract.ContractStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Request {
    public record RevenueRowRequest(
            @NotBlank(message = "Artist is required")
            String artist,
            String track,
            @NotBlank(message = "Platform is required")
            String platform,
            @NotBlank(message = "Country is required")
            String country,
            @NotBlank(message = "Period is required")
            String period,
            @PositiveOrZero(message = "Stream count cannot be negative")
            long streams,
            @NotNull(message = "Revenue amount is required")
            @DecimalMin(value = "0", message = "Revenue amount cannot be negative")
            BigDecimal revenue
    ) {}

    public record IngestRevenueRequest(
            @NotEmpty(message = "At least one revenue record is required")
            @Size(max = 50_000, message = "At most 50000 revenue records per batch")
            List<@Valid @NotNull RevenueRowRequest> records
    ) {}

    public record ReconcileRequest(
            @NotNull(message = "Actual payouts are required")
            Map<@NotBlank String, @NotNull BigDecimal> actualPayouts
    ) {}

    public record ReleaseRequest(
            Set<String> overrides
    ) {
        public Set<String> overridesOrEmpty() {
            return overrides == null ? Set.of() : overrides;
        }
    }

    public record SetSplitRequest(
            @NotNull(message = "Split fraction is required")
            BigDecimal fraction,
            @NotBlank(message = "A reason is required for every split change")
            String reason,
            @NotBlank(message = "An actor is required for every split change")
            String actor
    ) {}

    public record SetAdvanceRequest(
            @NotNull(message = "Advance balance is required")
            BigDecimal balance
    ) {}

    public record AddContractRequest(
            @Size(max = 200, message = "Artist can be 200 characters at most")
            @NotBlank(message = "Artist is required")
            String artist,
            @NotNull(message = "Split fraction is required")
            BigDecimal splitFraction,
            LocalDate signedDate,
            LocalDate expiryDate,
            String filePath,
            ContractFileType fileType,
            ContractStatus status,
            String notes
    ) {}

    public record EscalateRequest(
            @NotBlank(message = "Issue kind is required")
            String issueKind,
            @NotBlank(message = "Source component is required")
            String source,
            String detail
    ) {}
}
