package com.flagship.bnpl_ledger.settlement;

public enum MerchantStatus {
    ACTIVE,
    SUSPENDED
}
