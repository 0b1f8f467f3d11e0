package com.flagship.bnpl_ledger.installment;

import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A persisted installment of a repayment plan.
 *
 * A row may be paid in several parts; it turns PAID when {@code paidAmount == amount}.
 * Overdue is derived from the due date, the OVERDUE status column is only a cache of it.
 */
@Value
public class ScheduleRow {
    UUID id;
    UUID planId;
    int installmentNumber;
    BigDecimal amount;
    LocalDate dueDate;
    InstallmentStatus status;
    BigDecimal paidAmount;
    Instant paidAt;
    UUID lastPaymentId;

    public static ScheduleRow from(UUID planId, ScheduledInstallment installment) {
        return new ScheduleRow(UUID.randomUUID(), planId, installment.getInstallmentNumber(),
            installment.getAmount(), installment.getDueDate(), InstallmentStatus.PENDING, Money.ZERO, null, null);
    }

    public BigDecimal remaining() {
        return amount.subtract(paidAmount);
    }

    public boolean isSettled() {
        return status == InstallmentStatus.PAID || status == InstallmentStatus.SKIPPED;
    }

    public boolean isOverdue(LocalDate today) {
        return !isSettled() && dueDate.isBefore(today);
    }

    /**
     * The status a reader should see on {@code today}.
     */
    public InstallmentStatus effectiveStatus(LocalDate today) {
        return isOverdue(today) ? InstallmentStatus.OVERDUE : status;
    }

    /**
     * Puts {@code value} towards this row.
     *
     * @throws InvariantViolationException if the row is settled or {@code value} exceeds what is left
     */
    public ScheduleRow applyPayment(BigDecimal value, UUID paymentId, Instant now) {
        if (isSettled() || value.signum() <= 0 || value.compareTo(remaining()) > 0) {
            throw new InvariantViolationException(String.format(
                "Cannot apply %s to installment %d (status %s, remaining %s)",
                value.toPlainString(), installmentNumber, status, remaining().toPlainString()));
        }
        BigDecimal paid = paidAmount.add(value);
        boolean full = paid.compareTo(amount) == 0;
        return new ScheduleRow(id, planId, installmentNumber, amount, dueDate,
            full ? InstallmentStatus.PAID : status, paid, full ? now : paidAt, paymentId);
    }

    public ScheduleRow markOverdue() {
        if (status != InstallmentStatus.PENDING) {
            return this;
        }
        return new ScheduleRow(id, planId, installmentNumber, amount, dueDate, InstallmentStatus.OVERDUE,
            paidAmount, paidAt, lastPaymentId);
    }
}
