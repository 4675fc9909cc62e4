package com.flagship.payout_settlement.payment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for payment records.
 *
 * The only way to change an existing record is {@link #compareAndSet}: the
 * write succeeds only if the stored status still equals the expected one.
 * Records are never deleted.
 */
public interface PaymentRecordStore {

    Payment create(Payment payment);

    Optional<Payment> findById(UUID id);

    List<Payment> findForCreator(UUID creatorId, PaymentFilter filter);

    List<Payment> findForCompany(UUID companyId, PaymentFilter filter);

    List<Payment> findAll(PaymentFilter filter);

    /**
     * Writes the mutable fields of {@code updated} if and only if the stored
     * status is {@code expected}. Fee fields are never written.
     *
     * @return true if the row was updated, false if the status had moved on
     */
    boolean compareAndSet(UUID id, PaymentStatus expected, Payment updated);
}
