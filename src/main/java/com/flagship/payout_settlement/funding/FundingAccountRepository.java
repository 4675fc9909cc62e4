package com.flagship.payout_settlement.funding;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FundingAccountRepository extends JpaRepository<FundingAccountEntity, UUID> {

    List<FundingAccountEntity> findAllByOrderByPrimaryDescCreatedAtDesc();

    Optional<FundingAccountEntity> findFirstByPrimaryTrue();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE FundingAccountEntity a SET a.primary = false WHERE a.primary = true")
    int clearPrimary();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE FundingAccountEntity a SET a.primary = true WHERE a.id = :id AND a.status = :status")
    int promotePrimary(@Param("id") UUID id, @Param("status") FundingAccountStatus status);
}
