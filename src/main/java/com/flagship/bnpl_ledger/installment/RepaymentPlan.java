package com.flagship.bnpl_ledger.installment;

import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Summary of a transaction's installment schedule. Its counters move in lockstep with the rows.
 */
@Value
public class RepaymentPlan {
    UUID id;
    String planReference;
    UUID transactionId;
    UUID customerId;
    PlanType planType;
    BigDecimal totalAmount;
    BigDecimal installmentAmount;
    int numberOfInstallments;
    int installmentsPaid;
    BigDecimal amountPaid;
    BigDecimal remainingAmount;
    PlanStatus status;
    LocalDate nextPaymentDate;
    BigDecimal nextPaymentAmount;
    Instant completedAt;
    Instant createdAt;
    Instant updatedAt;

    public static RepaymentPlan create(UUID id, String planReference, UUID transactionId, UUID customerId,
                                       PlanType planType, BigDecimal totalAmount, BigDecimal installmentAmount,
                                       List<ScheduledInstallment> rows, Instant now) {
        ScheduledInstallment first = rows.get(0);
        return new RepaymentPlan(id, planReference, transactionId, customerId, planType, totalAmount,
            installmentAmount, rows.size(), 0, Money.ZERO, totalAmount, PlanStatus.ACTIVE,
            first.getDueDate(), first.getAmount(), null, now, now);
    }

    /**
     * Recomputes the counters after {@code amount} was applied and the rows became {@code rowsAfter}.
     */
    public RepaymentPlan recordPayment(BigDecimal amount, List<ScheduleRow> rowsAfter, Instant now) {
        BigDecimal paid = amountPaid.add(amount);
        BigDecimal remaining = remainingAmount.subtract(amount);
        if (remaining.signum() < 0) {
            throw new InvariantViolationException(String.format(
                "Plan %s: payment of %s exceeds remaining %s",
                planReference, amount.toPlainString(), remainingAmount.toPlainString()));
        }
        int paidRows = (int) rowsAfter.stream().filter(ScheduleRow::isSettled).count();
        ScheduleRow next = rowsAfter.stream()
            .filter(row -> !row.isSettled())
            .findFirst()
            .orElse(null);
        boolean completed = remaining.signum() == 0;
        if (completed != (next == null)) {
            throw new InvariantViolationException(String.format(
                "Plan %s: remaining %s does not match its schedule", planReference, remaining.toPlainString()));
        }
        return new RepaymentPlan(id, planReference, transactionId, customerId, planType, totalAmount,
            installmentAmount, numberOfInstallments, paidRows, paid, remaining,
            completed ? PlanStatus.COMPLETED : status,
            next != null ? next.getDueDate() : null,
            next != null ? next.remaining() : null,
            completed ? now : completedAt, createdAt, now);
    }

    public boolean isCompleted() {
        return status == PlanStatus.COMPLETED;
    }
}
