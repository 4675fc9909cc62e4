package com.flagship.payout_settlement.method;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payout destination registered by a creator.
 */
@Value
@Builder(toBuilder = true)
public class PaymentMethod {
    UUID id;
    UUID ownerId;
    PayoutMethodType type;
    String payoutEmail;
    String bankRoutingNumber;
    String bankAccountNumber;
    String paypalEmail;
    String cryptoWalletAddress;
    String cryptoNetwork;
    boolean isDefault;
    String externalAccountId;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Derives usability from the fields filled in for this method's type.
     */
    public PaymentMethodState getState() {
        boolean complete = switch (type) {
            case ETRANSFER -> hasText(payoutEmail);
            case WIRE -> hasText(bankRoutingNumber) && hasText(bankAccountNumber);
            case PAYPAL -> hasText(paypalEmail);
            case CRYPTO -> hasText(cryptoWalletAddress) && hasText(cryptoNetwork);
        };
        if (!complete) {
            return PaymentMethodState.INCOMPLETE;
        }
        if (type == PayoutMethodType.ETRANSFER && !hasText(externalAccountId)) {
            return PaymentMethodState.SETUP_REQUIRED;
        }
        return PaymentMethodState.READY;
    }

    /**
     * Destination reference handed to the payment rail.
     */
    public String getDestination() {
        return switch (type) {
            case ETRANSFER -> externalAccountId;
            case WIRE -> bankRoutingNumber + ":" + bankAccountNumber;
            case PAYPAL -> paypalEmail;
            case CRYPTO -> cryptoNetwork + ":" + cryptoWalletAddress;
        };
    }

    /**
     * Account details with all but the last four characters masked.
     */
    public String getMaskedDestination() {
        String destination = switch (type) {
            case ETRANSFER -> payoutEmail;
            case WIRE -> bankAccountNumber;
            case PAYPAL -> paypalEmail;
            case CRYPTO -> cryptoWalletAddress;
        };
        if (destination == null || destination.length() <= 4) {
            return destination;
        }
        return "*".repeat(destination.length() - 4) + destination.substring(destination.length() - 4);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
