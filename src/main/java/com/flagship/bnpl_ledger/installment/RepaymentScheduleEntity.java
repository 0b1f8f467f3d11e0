package com.flagship.bnpl_ledger.installment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
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
@Table(name = "repayment_schedules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RepaymentScheduleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "plan_id", nullable = false, updatable = false)
    private UUID planId;

    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InstallmentStatus status;

    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "last_payment_id")
    private UUID lastPaymentId;

    @Version
    private Long version;

    static RepaymentScheduleEntity fromDomain(ScheduleRow row) {
        return new RepaymentScheduleEntity(row.getId(), row.getPlanId(), row.getInstallmentNumber(),
            row.getAmount(), row.getDueDate(), row.getStatus(), row.getPaidAmount(), row.getPaidAt(),
            row.getLastPaymentId(), null);
    }

    public ScheduleRow toDomain() {
        return new ScheduleRow(id, planId, installmentNumber, amount, dueDate, status, paidAmount, paidAt,
            lastPaymentId);
    }

    void updateFromDomain(ScheduleRow row) {
        this.status = row.getStatus();
        this.paidAmount = row.getPaidAmount();
        this.paidAt = row.getPaidAt();
        this.lastPaymentId = row.getLastPaymentId();
    }
}
