package com.flagship.bnpl_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    List<PaymentEntity> findByTransactionIdOrderByCreatedAtAsc(UUID transactionId);

    List<PaymentEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);
}
