package com.flagship.payout_settlement.funding;

import com.flagship.payout_settlement.funding.dto.CreateFundingAccountRequest;
import com.flagship.payout_settlement.payment.exception.NotFoundException;
import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Admin management of the platform's funding accounts.
 *
 * At most one account is primary, and only an ACTIVE account can be.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundingAccountService {

    private final FundingAccountRepository repository;

    @Transactional
    public FundingAccount create(CreateFundingAccountRequest request) {
        if (request.getLast4() == null || !request.getLast4().matches("[A-Za-z0-9]{4}")) {
            throw new ValidationException("last4 must be exactly four characters");
        }
        FundingAccount account = FundingAccount.builder()
            .id(UUID.randomUUID())
            .name(request.getName().trim())
            .type(request.getType())
            .last4(request.getLast4())
            .status(request.getStatus() != null ? request.getStatus() : FundingAccountStatus.PENDING)
            .primary(false)
            .bankName(request.getBankName())
            .accountHolderName(request.getAccountHolderName())
            .walletNetwork(request.getWalletNetwork())
            .notes(request.getNotes())
            .build();

        FundingAccount saved = repository.saveAndFlush(FundingAccountEntity.fromDomain(account)).toDomain();
        log.info("Funding account created: id={}, type={}, status={}", saved.getId(), saved.getType(), saved.getStatus());
        return saved;
    }

    /**
     * All accounts, primary first.
     */
    @Transactional(readOnly = true)
    public List<FundingAccount> list() {
        return repository.findAllByOrderByPrimaryDescCreatedAtDesc().stream()
            .map(FundingAccountEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public FundingAccount get(UUID id) {
        return repository.findById(id)
            .map(FundingAccountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Funding account not found: " + id));
    }

    @Transactional(readOnly = true)
    public Optional<FundingAccount> findPrimary() {
        return repository.findFirstByPrimaryTrue().map(FundingAccountEntity::toDomain);
    }

    @Transactional
    public FundingAccount updateStatus(UUID id, FundingAccountStatus status) {
        if (status == null) {
            throw new ValidationException("Status is required");
        }
        FundingAccountEntity entity = repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Funding account not found: " + id));
        boolean wasPrimary = entity.isPrimary();
        entity.changeStatus(status);
        FundingAccount saved = repository.saveAndFlush(entity).toDomain();
        if (wasPrimary && !saved.isPrimary()) {
            log.warn("Funding account {} lost primary status after moving to {}; no primary account is set", id, status);
        }
        return saved;
    }

    /**
     * Makes an ACTIVE account primary, demoting the previous primary in the same transaction.
     * If the account stops being ACTIVE before the promotion lands, the demotion is rolled back.
     */
    @Transactional
    public FundingAccount setPrimary(UUID id) {
        FundingAccount account = get(id);
        if (account.getStatus() != FundingAccountStatus.ACTIVE) {
            throw new ValidationException("Only ACTIVE funding accounts can be primary; " + id + " is " + account.getStatus());
        }
        if (account.isPrimary()) {
            return account;
        }
        repository.clearPrimary();
        if (repository.promotePrimary(id, FundingAccountStatus.ACTIVE) == 0) {
            throw new ValidationException("Funding account " + id + " is no longer ACTIVE and cannot be primary");
        }
        log.info("Primary funding account changed to {}", id);
        return get(id);
    }

    @Transactional
    public void delete(UUID id) {
        FundingAccountEntity entity = repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Funding account not found: " + id));
        repository.delete(entity);
        log.info("Funding account deleted: id={}, wasPrimary={}", id, entity.isPrimary());
    }
}
