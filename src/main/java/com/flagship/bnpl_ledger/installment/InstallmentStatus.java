package com.flagship.bnpl_ledger.installment;

public enum InstallmentStatus {
    PENDING,
    PAID,
    OVERDUE,
    SKIPPED
}
