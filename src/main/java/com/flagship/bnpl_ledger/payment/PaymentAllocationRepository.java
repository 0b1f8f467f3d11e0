package com.flagship.bnpl_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentAllocationRepository extends JpaRepository<PaymentAllocationEntity, UUID> {

    List<PaymentAllocationEntity> findByPaymentIdOrderByInstallmentNumberAsc(UUID paymentId);
}
