package com.flagship.payout_settlement.method;

import com.flagship.payout_settlement.method.dto.RegisterPaymentMethodRequest;
import com.flagship.payout_settlement.payment.exception.NotFoundException;
import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of creator payout methods.
 *
 * Key invariants:
 * - An owner has zero or one default method
 * - The first method an owner registers becomes the default
 * - Deleting the default promotes the most recently created remaining method
 *
 * Every default switch runs demote-then-promote inside one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentMethodRegistry {

    private final PaymentMethodRepository repository;

    @Transactional
    public PaymentMethod register(UUID ownerId, RegisterPaymentMethodRequest request) {
        if (ownerId == null) {
            throw new ValidationException("Owner ID is required");
        }
        if (request.getType() == null) {
            throw new ValidationException("Payout method type is required");
        }

        PaymentMethod candidate = PaymentMethod.builder()
            .id(UUID.randomUUID())
            .ownerId(ownerId)
            .type(request.getType())
            .payoutEmail(trim(request.getPayoutEmail()))
            .bankRoutingNumber(trim(request.getBankRoutingNumber()))
            .bankAccountNumber(trim(request.getBankAccountNumber()))
            .paypalEmail(trim(request.getPaypalEmail()))
            .cryptoWalletAddress(trim(request.getCryptoWalletAddress()))
            .cryptoNetwork(trim(request.getCryptoNetwork()))
            .build();

        if (candidate.getState() == PaymentMethodState.INCOMPLETE) {
            throw new ValidationException(missingFieldsMessage(candidate.getType()));
        }

        boolean first = repository.countByOwnerId(ownerId) == 0;
        PaymentMethod toSave = candidate.toBuilder().isDefault(first).build();

        PaymentMethod saved = repository.saveAndFlush(PaymentMethodEntity.fromDomain(toSave)).toDomain();
        log.info("Registered payout method: ownerId={}, methodId={}, type={}, default={}, state={}",
            ownerId, saved.getId(), saved.getType(), saved.isDefault(), saved.getState());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<PaymentMethod> list(UUID ownerId) {
        return repository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
            .map(PaymentMethodEntity::toDomain)
            .sorted(Comparator.comparing(PaymentMethod::isDefault).reversed())
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentMethod> findDefault(UUID ownerId) {
        return repository.findFirstByOwnerIdAndIsDefaultTrue(ownerId).map(PaymentMethodEntity::toDomain);
    }

    /**
     * Makes a complete method the owner's default, demoting the previous one.
     */
    @Transactional
    public PaymentMethod setDefault(UUID ownerId, UUID methodId) {
        PaymentMethod method = load(ownerId, methodId);
        if (method.getState() == PaymentMethodState.INCOMPLETE) {
            throw new ValidationException("Payment method " + methodId + " is incomplete and cannot be the default");
        }
        if (method.isDefault()) {
            return method;
        }

        repository.clearDefaults(ownerId);
        repository.promoteDefault(ownerId, methodId);

        log.info("Default payout method changed: ownerId={}, methodId={}", ownerId, methodId);
        return load(ownerId, methodId);
    }

    /**
     * Deletes a method. If it was the default, the most recent remaining method is promoted.
     */
    @Transactional
    public void delete(UUID ownerId, UUID methodId) {
        PaymentMethodEntity entity = repository.findByIdAndOwnerId(methodId, ownerId)
            .orElseThrow(() -> new NotFoundException("Payment method not found: " + methodId));
        boolean wasDefault = entity.isDefault();

        repository.delete(entity);
        repository.flush();

        if (wasDefault) {
            repository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .findFirst()
                .ifPresent(next -> {
                    repository.promoteDefault(ownerId, next.getId());
                    log.info("Promoted payout method {} to default after deleting {}", next.getId(), methodId);
                });
        }
        log.info("Deleted payout method: ownerId={}, methodId={}", ownerId, methodId);
    }

    /**
     * Onboarding callback: records the rail's account reference, which clears
     * SETUP_REQUIRED on e-transfer methods.
     */
    @Transactional
    public PaymentMethod attachExternalAccount(UUID ownerId, UUID methodId, String externalAccountId) {
        if (externalAccountId == null || externalAccountId.isBlank()) {
            throw new ValidationException("External account ID is required");
        }
        PaymentMethodEntity entity = repository.findByIdAndOwnerId(methodId, ownerId)
            .orElseThrow(() -> new NotFoundException("Payment method not found: " + methodId));
        entity.attachExternalAccount(externalAccountId.trim());
        PaymentMethod updated = repository.saveAndFlush(entity).toDomain();
        log.info("Attached external account to payout method: methodId={}, state={}", methodId, updated.getState());
        return updated;
    }

    /**
     * Resolves the method a creator's payouts will be sent to.
     */
    @Transactional(readOnly = true)
    public SettlementMethod findSettlementMethod(UUID ownerId) {
        Optional<PaymentMethod> found = findDefault(ownerId);
        if (found.isEmpty()) {
            return SettlementMethod.unavailable(null, "Creator has no default payout method");
        }
        PaymentMethod method = found.get();
        return switch (method.getState()) {
            case READY -> SettlementMethod.usable(method);
            case SETUP_REQUIRED -> SettlementMethod.unavailable(method,
                "Payout account setup required: " + method.getType() + " has no connected external account");
            case INCOMPLETE -> SettlementMethod.unavailable(method,
                "Payout method " + method.getType() + " is missing required details");
        };
    }

    private PaymentMethod load(UUID ownerId, UUID methodId) {
        return repository.findByIdAndOwnerId(methodId, ownerId)
            .map(PaymentMethodEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Payment method not found: " + methodId));
    }

    private static String missingFieldsMessage(PayoutMethodType type) {
        return switch (type) {
            case ETRANSFER -> "E-transfer requires a payout email";
            case WIRE -> "Wire transfer requires a bank routing number and account number";
            case PAYPAL -> "PayPal requires a PayPal email";
            case CRYPTO -> "Crypto payouts require a wallet address and network";
        };
    }

    private static String trim(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
