package com.flagship.bnpl_ledger.installment;

public enum PlanStatus {
    ACTIVE,
    COMPLETED,
    DEFAULTED
}
