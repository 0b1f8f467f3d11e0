package com.flagship.bnpl_ledger.credit;

/**
 * Customer lifecycle status. Customers are never deleted, only moved between these states.
 */
public enum CustomerStatus {
    /** May receive and accept purchase requests. */
    ACTIVE,
    /** Temporarily barred from new purchases; existing plans keep running. */
    SUSPENDED,
    /** Permanently barred from new purchases. */
    BLOCKED
}
