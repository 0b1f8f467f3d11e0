package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.transaction.Transaction;
import lombok.Value;

import java.util.List;

/**
 * A recorded payment with its allocations and the transaction as it stands afterwards.
 * {@code replayed} is set when the payment was found by its idempotency key instead of applied.
 */
@Value
public class PaymentResult {
    Payment payment;
    List<PaymentAllocation> allocations;
    Transaction transaction;
    boolean replayed;
}
