package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.InsufficientBalanceException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A merchant and its withdrawable balance.
 *
 * The balance grows by the net amount of every accepted purchase and shrinks when a withdrawal
 * is requested. It is never negative.
 */
@Value
public class Merchant {

    public static final int MAX_BUSINESS_NAME_LENGTH = 255;

    UUID id;
    String businessName;
    MerchantStatus status;
    BigDecimal balance;
    BigDecimal totalCommissionPaid;
    int totalTransactions;
    BigDecimal totalVolume;
    BankDetails bankDetails;
    Instant createdAt;
    Instant updatedAt;

    public static Merchant register(UUID id, String businessName, BankDetails bankDetails, Instant now) {
        if (businessName == null || businessName.isBlank()) {
            throw new LedgerValidationException("Business name is required");
        }
        if (businessName.length() > MAX_BUSINESS_NAME_LENGTH) {
            throw new LedgerValidationException(
                "Business name must be at most " + MAX_BUSINESS_NAME_LENGTH + " characters");
        }
        return new Merchant(id, businessName.trim(), MerchantStatus.ACTIVE, Money.ZERO, Money.ZERO, 0,
            Money.ZERO, bankDetails, now, now);
    }

    /**
     * Books the income of one accepted purchase.
     */
    public Merchant accrueIncome(CommissionBreakdown breakdown, Instant now) {
        return new Merchant(id, businessName, status,
            balance.add(breakdown.getNetAmount()),
            totalCommissionPaid.add(breakdown.getCommissionAmount()),
            totalTransactions + 1,
            totalVolume.add(breakdown.getGrossAmount()),
            bankDetails, createdAt, now);
    }

    /**
     * @throws InsufficientBalanceException if {@code amount > balance}
     */
    public Merchant debit(BigDecimal amount, Instant now) {
        BigDecimal value = Money.positive(amount, "Withdrawal amount");
        if (value.compareTo(balance) > 0) {
            throw new InsufficientBalanceException(id, value, balance);
        }
        return new Merchant(id, businessName, status, balance.subtract(value), totalCommissionPaid,
            totalTransactions, totalVolume, bankDetails, createdAt, now);
    }

    /**
     * Puts a failed withdrawal back on the balance.
     */
    public Merchant credit(BigDecimal amount, Instant now) {
        BigDecimal value = Money.positive(amount, "Reversed amount");
        return new Merchant(id, businessName, status, balance.add(value), totalCommissionPaid,
            totalTransactions, totalVolume, bankDetails, createdAt, now);
    }

    public Merchant withBankDetails(BankDetails details, Instant now) {
        return new Merchant(id, businessName, status, balance, totalCommissionPaid, totalTransactions,
            totalVolume, details, createdAt, now);
    }

    public Merchant withStatus(MerchantStatus newStatus, Instant now) {
        return new Merchant(id, businessName, newStatus, balance, totalCommissionPaid, totalTransactions,
            totalVolume, bankDetails, createdAt, now);
    }

    public boolean isActive() {
        return status == MerchantStatus.ACTIVE;
    }

    public Merchant verified() {
        if (balance.signum() < 0) {
            throw new InvariantViolationException(
                "Merchant " + id + ": balance is negative: " + balance.toPlainString());
        }
        return this;
    }
}
