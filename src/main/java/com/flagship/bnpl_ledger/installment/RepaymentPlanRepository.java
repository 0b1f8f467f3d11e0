package com.flagship.bnpl_ledger.installment;

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
public interface RepaymentPlanRepository extends JpaRepository<RepaymentPlanEntity, UUID> {

    Optional<RepaymentPlanEntity> findByTransactionId(UUID transactionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM RepaymentPlanEntity p WHERE p.transactionId = :transactionId")
    Optional<RepaymentPlanEntity> findByTransactionIdForUpdate(@Param("transactionId") UUID transactionId);

    /**
     * Transactions that have at least one row in one of {@code statuses} due before {@code today}.
     */
    @Query("SELECT DISTINCT p.transactionId FROM RepaymentPlanEntity p, RepaymentScheduleEntity s "
        + "WHERE s.planId = p.id AND s.status IN :statuses AND s.dueDate < :today")
    List<UUID> findTransactionIdsWithRowsDueBefore(@Param("statuses") Collection<InstallmentStatus> statuses,
                                                   @Param("today") LocalDate today);
}
