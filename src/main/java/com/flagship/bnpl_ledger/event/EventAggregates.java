package com.flagship.bnpl_ledger.event;

/**
 * Aggregate type names written to the outbox.
 */
public final class EventAggregates {

    public static final String CUSTOMER = "Customer";
    public static final String MERCHANT = "Merchant";
    public static final String PURCHASE_REQUEST = "PurchaseRequest";
    public static final String TRANSACTION = "Transaction";

    private EventAggregates() {
    }
}
