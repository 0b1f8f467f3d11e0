package com.flagship.bnpl_ledger.credit;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, UUID> {

    /**
     * Loads the customer with {@code SELECT ... FOR UPDATE}. Every balance mutation goes through here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerEntity c WHERE c.id = :id")
    Optional<CustomerEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByCustomerCode(String customerCode);
}
