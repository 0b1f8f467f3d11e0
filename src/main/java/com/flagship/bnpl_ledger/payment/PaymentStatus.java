package com.flagship.bnpl_ledger.payment;

/**
 * Payment status. Payments applied by the ledger are recorded COMPLETED; the other values are
 * for gateway-driven flows.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED
}
