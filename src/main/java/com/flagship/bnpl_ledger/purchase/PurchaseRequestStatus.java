package com.flagship.bnpl_ledger.purchase;

/**
 * Purchase request lifecycle. PENDING is the only non-terminal state.
 */
public enum PurchaseRequestStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
