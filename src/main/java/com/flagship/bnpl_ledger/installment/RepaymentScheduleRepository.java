package com.flagship.bnpl_ledger.installment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RepaymentScheduleRepository extends JpaRepository<RepaymentScheduleEntity, UUID> {

    List<RepaymentScheduleEntity> findByPlanIdOrderByInstallmentNumberAsc(UUID planId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM RepaymentScheduleEntity s WHERE s.planId = :planId ORDER BY s.installmentNumber ASC")
    List<RepaymentScheduleEntity> findByPlanIdForUpdate(@Param("planId") UUID planId);
}
