package com.flagship.bnpl_ledger.settlement;

/**
 * INCOME credits the merchant balance when a purchase is accepted; WITHDRAWAL pays it out.
 */
public enum SettlementType {
    INCOME,
    WITHDRAWAL
}
