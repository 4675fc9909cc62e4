package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to record a payout for an eligible conversion.
 * platform_fee_rate is a fraction (0.04 = 4%); when absent the platform setting applies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPaymentRequest {

    @NotNull(message = "Creator ID is required")
    @JsonProperty("creator_id")
    private UUID creatorId;

    @NotNull(message = "Company ID is required")
    @JsonProperty("company_id")
    private UUID companyId;

    @JsonProperty("offer_id")
    private UUID offerId;

    @NotNull(message = "Gross amount is required")
    @DecimalMin(value = "0.00", message = "Gross amount cannot be negative")
    @JsonProperty("gross_amount")
    private BigDecimal grossAmount;

    @DecimalMin(value = "0.00", message = "Platform fee rate cannot be negative")
    @DecimalMax(value = "1.00", message = "Platform fee rate cannot exceed 1.00")
    @JsonProperty("platform_fee_rate")
    private BigDecimal platformFeeRate;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    private String description;
}
