package com.flagship.payout_settlement.method.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.method.PayoutMethodType;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a payout method. Which fields are required depends on the type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPaymentMethodRequest {

    @NotNull(message = "Payout method type is required")
    @JsonProperty("type")
    private PayoutMethodType type;

    @Email(message = "Payout email must be a valid email")
    @JsonProperty("payout_email")
    private String payoutEmail;

    @JsonProperty("bank_routing_number")
    private String bankRoutingNumber;

    @JsonProperty("bank_account_number")
    private String bankAccountNumber;

    @Email(message = "PayPal email must be a valid email")
    @JsonProperty("paypal_email")
    private String paypalEmail;

    @JsonProperty("crypto_wallet_address")
    private String cryptoWalletAddress;

    @JsonProperty("crypto_network")
    private String cryptoNetwork;
}
