package com.flagship.bnpl_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An append-only record of money received against a transaction.
 */
@Value
public class Payment {
    UUID id;
    String referenceNumber;
    UUID transactionId;
    UUID customerId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    PaymentStatus status;
    int installmentsCovered;
    String idempotencyKey;
    Instant createdAt;

    public static Payment completed(UUID id, String referenceNumber, UUID transactionId, UUID customerId,
                                    BigDecimal amount, PaymentMethod method, int installmentsCovered,
                                    String idempotencyKey, Instant now) {
        return new Payment(id, referenceNumber, transactionId, customerId, amount, method,
            PaymentStatus.COMPLETED, installmentsCovered, idempotencyKey, now);
    }
}
