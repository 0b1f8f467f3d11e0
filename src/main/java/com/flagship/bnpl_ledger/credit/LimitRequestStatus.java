package com.flagship.bnpl_ledger.credit;

public enum LimitRequestStatus {
    PENDING,
    APPROVED,
    REJECTED
}
