package com.flagship.bnpl_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "payment_allocations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentAllocationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(name = "schedule_id", nullable = false, updatable = false)
    private UUID scheduleId;

    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    static PaymentAllocationEntity fromDomain(PaymentAllocation allocation) {
        return new PaymentAllocationEntity(allocation.getId(), allocation.getPaymentId(), allocation.getScheduleId(),
            allocation.getInstallmentNumber(), allocation.getAmount());
    }

    public PaymentAllocation toDomain() {
        return new PaymentAllocation(id, paymentId, scheduleId, installmentNumber, amount);
    }
}
