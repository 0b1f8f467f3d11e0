package com.flagship.bnpl_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Split of a gross amount into platform commission and merchant net. {@code net + commission == gross}.
 */
@Value
public class CommissionBreakdown {
    BigDecimal grossAmount;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    BigDecimal netAmount;
}
