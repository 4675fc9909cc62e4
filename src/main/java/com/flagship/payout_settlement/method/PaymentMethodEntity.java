package com.flagship.payout_settlement.method;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for registered payout methods.
 *
 * The single-default rule is also enforced by a partial unique index on
 * (owner_id) WHERE is_default, so a lost race surfaces as a constraint violation.
 */
@Entity
@Table(
    name = "payment_methods",
    indexes = @Index(name = "idx_payment_methods_owner", columnList = "owner_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentMethodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 20)
    private PayoutMethodType type;

    @Column(name = "payout_email")
    private String payoutEmail;

    @Column(name = "bank_routing_number")
    private String bankRoutingNumber;

    @Column(name = "bank_account_number")
    private String bankAccountNumber;

    @Column(name = "paypal_email")
    private String paypalEmail;

    @Column(name = "crypto_wallet_address")
    private String cryptoWalletAddress;

    @Column(name = "crypto_network")
    private String cryptoNetwork;

    @Column(name = "is_default", nullable = false)
    private boolean isDefault;

    @Column(name = "external_account_id")
    private String externalAccountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentMethodEntity fromDomain(PaymentMethod method) {
        return new PaymentMethodEntity(
            method.getId(),
            method.getOwnerId(),
            method.getType(),
            method.getPayoutEmail(),
            method.getBankRoutingNumber(),
            method.getBankAccountNumber(),
            method.getPaypalEmail(),
            method.getCryptoWalletAddress(),
            method.getCryptoNetwork(),
            method.isDefault(),
            method.getExternalAccountId(),
            null,
            null
        );
    }

    public PaymentMethod toDomain() {
        return PaymentMethod.builder()
            .id(id)
            .ownerId(ownerId)
            .type(type)
            .payoutEmail(payoutEmail)
            .bankRoutingNumber(bankRoutingNumber)
            .bankAccountNumber(bankAccountNumber)
            .paypalEmail(paypalEmail)
            .cryptoWalletAddress(cryptoWalletAddress)
            .cryptoNetwork(cryptoNetwork)
            .isDefault(isDefault)
            .externalAccountId(externalAccountId)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void attachExternalAccount(String externalAccountId) {
        this.externalAccountId = externalAccountId;
    }
}
