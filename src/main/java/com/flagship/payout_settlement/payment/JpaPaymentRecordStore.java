package com.flagship.payout_settlement.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed payment store.
 *
 * Bridges the domain layer (Payment) and the persistence layer (PaymentEntity).
 * Listings load the scope (creator, company, status set) in SQL and apply the
 * remaining filter criteria in memory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPaymentRecordStore implements PaymentRecordStore {

    private final PaymentRepository paymentRepository;

    @Override
    @Transactional
    public Payment create(Payment payment) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
        log.debug("Saved payment {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID id) {
        return paymentRepository.findById(id).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findForCreator(UUID creatorId, PaymentFilter filter) {
        return apply(paymentRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId), filter);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findForCompany(UUID companyId, PaymentFilter filter) {
        return apply(paymentRepository.findByCompanyIdOrderByCreatedAtDesc(companyId), filter);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findAll(PaymentFilter filter) {
        List<PaymentEntity> rows = filter.getStatuses() != null && !filter.getStatuses().isEmpty()
            ? paymentRepository.findByStatusInOrderByCreatedAtDesc(filter.getStatuses())
            : paymentRepository.findAllByOrderByCreatedAtDesc();
        return apply(rows, filter);
    }

    @Override
    @Transactional
    public boolean compareAndSet(UUID id, PaymentStatus expected, Payment updated) {
        PaymentFailure failure = updated.getFailure();
        int rows = paymentRepository.compareAndSet(
            id,
            expected,
            updated.getStatus(),
            failure != null ? failure.getKind() : null,
            failure != null ? failure.getReason() : null,
            updated.getPayoutMethod(),
            updated.getDescription(),
            updated.getRailTransactionId(),
            updated.getUpdatedAt(),
            updated.getCompletedAt(),
            updated.getRefundedAt()
        );
        log.debug("Compare-and-set payment {}: {} -> {}, rows={}", id, expected, updated.getStatus(), rows);
        return rows == 1;
    }

    private static List<Payment> apply(List<PaymentEntity> rows, PaymentFilter filter) {
        return rows.stream()
            .map(PaymentEntity::toDomain)
            .filter(filter::matches)
            .toList();
    }
}
