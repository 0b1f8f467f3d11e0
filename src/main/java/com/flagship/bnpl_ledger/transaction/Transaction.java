package com.flagship.bnpl_ledger.transaction;

import com.flagship.bnpl_ledger.exception.InvalidAmountException;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.TransactionNotActiveException;
import com.flagship.bnpl_ledger.money.Money;
import com.flagship.bnpl_ledger.settlement.CommissionBreakdown;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The debt created when a customer accepts a purchase request.
 *
 * {@code paidAmount} only grows, {@code remainingBalance == totalAmount - paidAmount}, and the
 * transaction is COMPLETED exactly when nothing remains. The commission rate is fixed here at
 * creation and never recomputed.
 */
@Value
public class Transaction {
    UUID id;
    String transactionNumber;
    UUID merchantId;
    UUID customerId;
    UUID purchaseRequestId;
    BigDecimal totalAmount;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    BigDecimal netAmount;
    BigDecimal paidAmount;
    BigDecimal remainingBalance;
    TransactionStatus status;
    LocalDate dueDate;
    Instant completedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Transaction open(UUID id, String transactionNumber, UUID merchantId, UUID customerId,
                                   UUID purchaseRequestId, CommissionBreakdown commission,
                                   LocalDate dueDate, Instant now) {
        return new Transaction(id, transactionNumber, merchantId, customerId, purchaseRequestId,
            commission.getGrossAmount(), commission.getCommissionRate(), commission.getCommissionAmount(),
            commission.getNetAmount(), Money.ZERO, commission.getGrossAmount(), TransactionStatus.ACTIVE,
            dueDate, null, now, now)
            .verified();
    }

    /**
     * Checks that a payment of {@code amount} may be applied.
     *
     * @throws TransactionNotActiveException unless ACTIVE or OVERDUE
     * @throws InvalidAmountException if the amount is not positive or exceeds the remaining balance
     */
    public BigDecimal validatePayment(BigDecimal amount) {
        if (!status.acceptsPayments()) {
            throw new TransactionNotActiveException(id, status);
        }
        BigDecimal value = Money.positive(amount, "Payment amount");
        if (value.compareTo(remainingBalance) > 0) {
            throw new InvalidAmountException(String.format(
                "Payment %s exceeds remaining balance %s of transaction %s",
                value.toPlainString(), remainingBalance.toPlainString(), transactionNumber));
        }
        return value;
    }

    /**
     * Applies a validated payment.
     *
     * @param stillOverdue whether any installment is still past due after the payment
     */
    public Transaction applyPayment(BigDecimal amount, boolean stillOverdue, Instant now) {
        BigDecimal value = validatePayment(amount);
        BigDecimal paid = paidAmount.add(value);
        BigDecimal remaining = remainingBalance.subtract(value);
        boolean completed = remaining.signum() == 0;
        TransactionStatus next = completed
            ? TransactionStatus.COMPLETED
            : stillOverdue ? TransactionStatus.OVERDUE : TransactionStatus.ACTIVE;
        return new Transaction(id, transactionNumber, merchantId, customerId, purchaseRequestId, totalAmount,
            commissionRate, commissionAmount, netAmount, paid, remaining, next, dueDate,
            completed ? now : null, createdAt, now)
            .verified();
    }

    public Transaction markOverdue(Instant now) {
        if (!canTransitionTo(TransactionStatus.OVERDUE)) {
            throw new InvalidStateException(String.format(
                "Cannot mark transaction %s overdue in %s status", transactionNumber, status));
        }
        return withStatus(TransactionStatus.OVERDUE, now);
    }

    /**
     * This transaction as a reader sees it: ACTIVE with a past-due installment reads OVERDUE.
     */
    public Transaction presented(boolean hasOverdueInstallment) {
        if (status == TransactionStatus.ACTIVE && hasOverdueInstallment) {
            return withStatus(TransactionStatus.OVERDUE, updatedAt);
        }
        return this;
    }

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }

    public boolean canTransitionTo(TransactionStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case ACTIVE -> target == TransactionStatus.OVERDUE || target == TransactionStatus.COMPLETED
                || target == TransactionStatus.DEFAULTED || target == TransactionStatus.CANCELLED;
            case OVERDUE -> target == TransactionStatus.ACTIVE || target == TransactionStatus.COMPLETED
                || target == TransactionStatus.DEFAULTED;
            case COMPLETED, DEFAULTED, CANCELLED -> false;
        };
    }

    public Transaction verified() {
        if (paidAmount.signum() < 0 || paidAmount.compareTo(totalAmount) > 0) {
            throw new InvariantViolationException(String.format(
                "Transaction %s: paid %s outside [0, %s]", transactionNumber,
                paidAmount.toPlainString(), totalAmount.toPlainString()));
        }
        if (remainingBalance.compareTo(totalAmount.subtract(paidAmount)) != 0) {
            throw new InvariantViolationException(String.format(
                "Transaction %s: remaining %s != total %s - paid %s", transactionNumber,
                remainingBalance.toPlainString(), totalAmount.toPlainString(), paidAmount.toPlainString()));
        }
        if ((status == TransactionStatus.COMPLETED) != (remainingBalance.signum() == 0)) {
            throw new InvariantViolationException(String.format(
                "Transaction %s: status %s with remaining %s", transactionNumber, status,
                remainingBalance.toPlainString()));
        }
        return this;
    }

    private Transaction withStatus(TransactionStatus newStatus, Instant now) {
        return new Transaction(id, transactionNumber, merchantId, customerId, purchaseRequestId, totalAmount,
            commissionRate, commissionAmount, netAmount, paidAmount, remainingBalance, newStatus, dueDate,
            completedAt, createdAt, now);
    }
}
