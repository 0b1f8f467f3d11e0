package com.flagship.bnpl_ledger.reporting;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MerchantStats {
    long totalTransactions;
    BigDecimal totalVolume;
    long activeTransactions;
    long completedTransactions;
    BigDecimal totalIncome;
    BigDecimal totalCommission;
    /** Withdrawals the bank confirmed. */
    BigDecimal totalWithdrawn;
    /** Withdrawals requested but not yet completed or failed. */
    BigDecimal pendingWithdrawals;
    BigDecimal withdrawnThisMonth;
    BigDecimal balance;
}
