package com.flagship.bnpl_ledger.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseRequestRepository extends JpaRepository<PurchaseRequestEntity, UUID> {

    /**
     * Locks the request row. Taken first in every write path so concurrent accepts serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PurchaseRequestEntity r WHERE r.id = :id")
    Optional<PurchaseRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    List<PurchaseRequestEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    List<PurchaseRequestEntity> findByMerchantIdOrderByCreatedAtDesc(UUID merchantId);

    @Query("SELECT r.id FROM PurchaseRequestEntity r WHERE r.status = :status AND r.expiresAt <= :now")
    List<UUID> findIdsWithStatusExpiredBy(@Param("status") PurchaseRequestStatus status, @Param("now") Instant now);
}
