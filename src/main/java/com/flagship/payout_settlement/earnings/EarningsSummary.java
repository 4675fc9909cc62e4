package com.flagship.payout_settlement.earnings;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Earnings buckets. {@code total} is pending + processing + completed;
 * disputed amounts are reported apart and never included in total.
 */
@Value
public class EarningsSummary {

    @JsonProperty("basis")
    AmountBasis basis;

    @JsonProperty("total_earnings")
    BigDecimal totalEarnings;

    @JsonProperty("pending_earnings")
    BigDecimal pendingEarnings;

    @JsonProperty("processing_earnings")
    BigDecimal processingEarnings;

    @JsonProperty("completed_earnings")
    BigDecimal completedEarnings;

    @JsonProperty("disputed_earnings")
    BigDecimal disputedEarnings;
}
