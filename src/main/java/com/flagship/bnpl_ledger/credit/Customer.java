package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer's credit position under the reservation model.
 *
 * Accepting a purchase moves money from {@code availableBalance} to {@code outstandingBalance};
 * paying an installment moves it back. At all times
 * {@code availableBalance + outstandingBalance == creditLimit} and
 * {@code 0 <= availableBalance <= creditLimit}.
 *
 * Immutable: every operation returns a new instance and re-checks the invariant.
 */
@Value
public class Customer {
    UUID id;
    String customerCode;
    BigDecimal creditLimit;
    BigDecimal availableBalance;
    BigDecimal outstandingBalance;
    CustomerStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static Customer register(UUID id, String customerCode, BigDecimal creditLimit, Instant now) {
        BigDecimal limit = Money.of(creditLimit);
        if (limit.signum() < 0) {
            throw new LedgerValidationException("Credit limit cannot be negative");
        }
        return new Customer(id, customerCode, limit, limit, Money.ZERO, CustomerStatus.ACTIVE, now, now)
            .verified();
    }

    /**
     * Moves {@code amount} from available to outstanding.
     *
     * @throws InsufficientCreditException if {@code amount > availableBalance}
     */
    public Customer reserve(BigDecimal amount, Instant now) {
        BigDecimal value = Money.positive(amount, "Reserved amount");
        if (value.compareTo(availableBalance) > 0) {
            throw new InsufficientCreditException(id, value, availableBalance);
        }
        return new Customer(id, customerCode, creditLimit,
            availableBalance.subtract(value), outstandingBalance.add(value), status, createdAt, now)
            .verified();
    }

    /**
     * Moves {@code amount} from outstanding back to available.
     *
     * @throws InvariantViolationException if more is released than is outstanding
     */
    public Customer release(BigDecimal amount, Instant now) {
        BigDecimal value = Money.positive(amount, "Released amount");
        if (value.compareTo(outstandingBalance) > 0) {
            throw new InvariantViolationException(String.format(
                "Release of %s for customer %s exceeds outstanding balance %s",
                value.toPlainString(), id, outstandingBalance.toPlainString()));
        }
        return new Customer(id, customerCode, creditLimit,
            availableBalance.add(value), outstandingBalance.subtract(value), status, createdAt, now)
            .verified();
    }

    /**
     * Raises the limit; the whole delta becomes available.
     */
    public Customer raiseLimit(BigDecimal newLimit, Instant now) {
        BigDecimal limit = Money.of(newLimit);
        if (limit.compareTo(creditLimit) <= 0) {
            throw new LedgerValidationException(String.format(
                "New limit %s must be greater than current limit %s",
                limit.toPlainString(), creditLimit.toPlainString()));
        }
        BigDecimal delta = limit.subtract(creditLimit);
        return new Customer(id, customerCode, limit, availableBalance.add(delta), outstandingBalance,
            status, createdAt, now)
            .verified();
    }

    public Customer withStatus(CustomerStatus newStatus, Instant now) {
        return new Customer(id, customerCode, creditLimit, availableBalance, outstandingBalance,
            newStatus, createdAt, now);
    }

    public boolean isActive() {
        return status == CustomerStatus.ACTIVE;
    }

    /**
     * Returns this instance if the conservation invariant holds.
     *
     * @throws InvariantViolationException otherwise
     */
    public Customer verified() {
        if (availableBalance.add(outstandingBalance).compareTo(creditLimit) != 0) {
            throw new InvariantViolationException(String.format(
                "Customer %s: available %s + outstanding %s != limit %s",
                id, availableBalance.toPlainString(), outstandingBalance.toPlainString(),
                creditLimit.toPlainString()));
        }
        if (availableBalance.signum() < 0 || availableBalance.compareTo(creditLimit) > 0) {
            throw new InvariantViolationException(String.format(
                "Customer %s: available %s outside [0, %s]",
                id, availableBalance.toPlainString(), creditLimit.toPlainString()));
        }
        if (outstandingBalance.signum() < 0) {
            throw new InvariantViolationException(
                "Customer " + id + ": outstanding balance is negative: " + outstandingBalance.toPlainString());
        }
        return this;
    }
}
