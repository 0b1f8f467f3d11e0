package com.flagship.bnpl_ledger.transaction;

public enum TransactionStatus {
    ACTIVE,
    COMPLETED,
    OVERDUE,
    DEFAULTED,
    CANCELLED;

    public boolean acceptsPayments() {
        return this == ACTIVE || this == OVERDUE;
    }
}
