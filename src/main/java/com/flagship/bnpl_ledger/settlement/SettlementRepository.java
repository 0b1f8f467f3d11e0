package com.flagship.bnpl_ledger.settlement;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SettlementEntity s WHERE s.id = :id")
    Optional<SettlementEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT s.merchantId FROM SettlementEntity s WHERE s.id = :id")
    Optional<UUID> findMerchantIdById(@Param("id") UUID id);

    List<SettlementEntity> findByMerchantIdOrderByCreatedAtDesc(UUID merchantId);

    List<SettlementEntity> findByMerchantIdAndSettlementTypeOrderByCreatedAtDesc(UUID merchantId,
                                                                                SettlementType settlementType);

    boolean existsByTransactionIdAndSettlementType(UUID transactionId, SettlementType settlementType);
}
