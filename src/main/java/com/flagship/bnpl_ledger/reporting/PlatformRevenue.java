package com.flagship.bnpl_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Commission earned from completed income settlements in {@code [from, to)}; open ends mean unbounded.
 */
@Value
public class PlatformRevenue {
    LocalDate from;
    LocalDate to;
    long transactionCount;
    BigDecimal grossVolume;
    BigDecimal totalCommission;
    BigDecimal netToMerchants;
}
