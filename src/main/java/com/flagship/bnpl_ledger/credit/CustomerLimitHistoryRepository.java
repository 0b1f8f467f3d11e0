package com.flagship.bnpl_ledger.credit;

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
public interface CustomerLimitHistoryRepository extends JpaRepository<CustomerLimitHistoryEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM CustomerLimitHistoryEntity h WHERE h.id = :id")
    Optional<CustomerLimitHistoryEntity> findByIdForUpdate(@Param("id") UUID id);

    List<CustomerLimitHistoryEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    List<CustomerLimitHistoryEntity> findByStatusOrderByCreatedAtAsc(LimitRequestStatus status);
}
