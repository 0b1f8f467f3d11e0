package com.flagship.bnpl_ledger.transaction;

import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionEntity t WHERE t.id = :id")
    Optional<TransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    List<TransactionEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    List<TransactionEntity> findByMerchantIdOrderByCreatedAtDesc(UUID merchantId);

    /**
     * Ids of the given transactions that have an unsettled installment due before {@code today}.
     */
    @Query("SELECT DISTINCT p.transactionId FROM RepaymentPlanEntity p, RepaymentScheduleEntity s "
        + "WHERE s.planId = p.id AND p.transactionId IN :ids AND s.status IN :statuses AND s.dueDate < :today")
    List<UUID> findIdsWithInstallmentsDueBefore(@Param("ids") Collection<UUID> ids,
                                                @Param("statuses") Collection<InstallmentStatus> statuses,
                                                @Param("today") LocalDate today);
}
