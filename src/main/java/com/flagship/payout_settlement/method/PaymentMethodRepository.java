package com.flagship.payout_settlement.method;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentMethodRepository extends JpaRepository<PaymentMethodEntity, UUID> {

    List<PaymentMethodEntity> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    Optional<PaymentMethodEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<PaymentMethodEntity> findFirstByOwnerIdAndIsDefaultTrue(UUID ownerId);

    long countByOwnerId(UUID ownerId);

    /**
     * Clears the default flag on every method of an owner.
     * Must run before {@link #promoteDefault} in the same transaction.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentMethodEntity m SET m.isDefault = false WHERE m.ownerId = :ownerId AND m.isDefault = true")
    int clearDefaults(@Param("ownerId") UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentMethodEntity m SET m.isDefault = true WHERE m.id = :id AND m.ownerId = :ownerId")
    int promoteDefault(@Param("ownerId") UUID ownerId, @Param("id") UUID id);
}
