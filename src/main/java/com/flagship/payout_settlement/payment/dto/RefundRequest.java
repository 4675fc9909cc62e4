package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefundRequest {

    @Size(max = 1000, message = "Reason is limited to 1000 characters")
    @JsonProperty("reason")
    private String reason;
}
