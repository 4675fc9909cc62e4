package com.flagship.payout_settlement.settlement.rail;

import com.flagship.payout_settlement.method.PayoutMethodType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One disbursement instruction. The rail deduplicates on {@code idempotencyKey}.
 */
@Value
@Builder
public class RailRequest {
    UUID paymentId;
    BigDecimal amount;
    PayoutMethodType method;
    String destination;
    String idempotencyKey;
}
