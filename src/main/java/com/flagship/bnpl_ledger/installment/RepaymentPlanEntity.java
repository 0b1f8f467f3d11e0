package com.flagship.bnpl_ledger.installment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "repayment_plans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RepaymentPlanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "plan_reference", nullable = false, updatable = false, length = 40)
    private String planReference;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    // Stored as the number of installments (1, 3, 6, ...)
    @Column(name = "plan_type", nullable = false, updatable = false)
    private int planType;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "installment_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal installmentAmount;

    @Column(name = "number_of_installments", nullable = false, updatable = false)
    private int numberOfInstallments;

    @Column(name = "installments_paid", nullable = false)
    private int installmentsPaid;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "remaining_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal remainingAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PlanStatus status;

    @Column(name = "next_payment_date")
    private LocalDate nextPaymentDate;

    @Column(name = "next_payment_amount", precision = 19, scale = 2)
    private BigDecimal nextPaymentAmount;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    static RepaymentPlanEntity fromDomain(RepaymentPlan plan) {
        return new RepaymentPlanEntity(
            plan.getId(),
            plan.getPlanReference(),
            plan.getTransactionId(),
            plan.getCustomerId(),
            plan.getPlanType().getInstallments(),
            plan.getTotalAmount(),
            plan.getInstallmentAmount(),
            plan.getNumberOfInstallments(),
            plan.getInstallmentsPaid(),
            plan.getAmountPaid(),
            plan.getRemainingAmount(),
            plan.getStatus(),
            plan.getNextPaymentDate(),
            plan.getNextPaymentAmount(),
            plan.getCompletedAt(),
            null,
            plan.getCreatedAt(),
            plan.getUpdatedAt()
        );
    }

    public RepaymentPlan toDomain() {
        return new RepaymentPlan(id, planReference, transactionId, customerId, PlanType.fromInstallments(planType),
            totalAmount, installmentAmount, numberOfInstallments, installmentsPaid, amountPaid, remainingAmount,
            status, nextPaymentDate, nextPaymentAmount, completedAt, createdAt, updatedAt);
    }

    void updateFromDomain(RepaymentPlan plan) {
        this.installmentsPaid = plan.getInstallmentsPaid();
        this.amountPaid = plan.getAmountPaid();
        this.remainingAmount = plan.getRemainingAmount();
        this.status = plan.getStatus();
        this.nextPaymentDate = plan.getNextPaymentDate();
        this.nextPaymentAmount = plan.getNextPaymentAmount();
        this.completedAt = plan.getCompletedAt();
    }
}
