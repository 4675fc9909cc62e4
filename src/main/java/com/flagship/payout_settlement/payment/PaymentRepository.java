package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.method.PayoutMethodType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    List<PaymentEntity> findByCreatorIdOrderByCreatedAtDesc(UUID creatorId);

    List<PaymentEntity> findByCompanyIdOrderByCreatedAtDesc(UUID companyId);

    List<PaymentEntity> findByStatusInOrderByCreatedAtDesc(Collection<PaymentStatus> statuses);

    List<PaymentEntity> findAllByOrderByCreatedAtDesc();

    /**
     * Compare-and-set on status. Writes the mutable columns only when the row
     * still holds the expected status; returns the number of rows changed (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE PaymentEntity p
        SET p.status = :newStatus,
            p.failureKind = :failureKind,
            p.failureReason = :failureReason,
            p.payoutMethod = :payoutMethod,
            p.description = :description,
            p.railTransactionId = :railTransactionId,
            p.updatedAt = :updatedAt,
            p.completedAt = :completedAt,
            p.refundedAt = :refundedAt
        WHERE p.id = :id AND p.status = :expected
        """)
    int compareAndSet(@Param("id") UUID id,
                      @Param("expected") PaymentStatus expected,
                      @Param("newStatus") PaymentStatus newStatus,
                      @Param("failureKind") FailureKind failureKind,
                      @Param("failureReason") String failureReason,
                      @Param("payoutMethod") PayoutMethodType payoutMethod,
                      @Param("description") String description,
                      @Param("railTransactionId") String railTransactionId,
                      @Param("updatedAt") Instant updatedAt,
                      @Param("completedAt") Instant completedAt,
                      @Param("refundedAt") Instant refundedAt);
}
