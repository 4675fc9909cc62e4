package com.flagship.payout_settlement.funding;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for funding accounts. A partial unique index on is_primary
 * keeps at most one primary row.
 */
@Entity
@Table(name = "funding_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundingAccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private FundingAccountType type;

    @Column(name = "last4", nullable = false, length = 4)
    private String last4;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FundingAccountStatus status;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Column(name = "bank_name")
    private String bankName;

    @Column(name = "account_holder_name")
    private String accountHolderName;

    @Column(name = "wallet_network")
    private String walletNetwork;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

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

    static FundingAccountEntity fromDomain(FundingAccount account) {
        FundingAccountEntity entity = new FundingAccountEntity();
        entity.id = account.getId();
        entity.name = account.getName();
        entity.type = account.getType();
        entity.last4 = account.getLast4();
        entity.status = account.getStatus();
        entity.primary = account.isPrimary();
        entity.bankName = account.getBankName();
        entity.accountHolderName = account.getAccountHolderName();
        entity.walletNetwork = account.getWalletNetwork();
        entity.notes = account.getNotes();
        return entity;
    }

    FundingAccount toDomain() {
        return FundingAccount.builder()
            .id(id)
            .name(name)
            .type(type)
            .last4(last4)
            .status(status)
            .primary(primary)
            .bankName(bankName)
            .accountHolderName(accountHolderName)
            .walletNetwork(walletNetwork)
            .notes(notes)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Disabling or suspending an account drops its primary flag.
     */
    void changeStatus(FundingAccountStatus newStatus) {
        this.status = newStatus;
        if (newStatus != FundingAccountStatus.ACTIVE) {
            this.primary = false;
        }
    }
}
