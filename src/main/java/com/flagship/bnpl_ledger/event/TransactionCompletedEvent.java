package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.transaction.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionCompletedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransactionCompleted";

    UUID eventId;
    UUID transactionId;
    UUID customerId;
    UUID merchantId;
    BigDecimal totalAmount;
    Instant occurredAt;

    public static TransactionCompletedEvent from(Transaction transaction) {
        return new TransactionCompletedEvent(UUID.randomUUID(), transaction.getId(), transaction.getCustomerId(),
            transaction.getMerchantId(), transaction.getTotalAmount(), transaction.getCompletedAt());
    }

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return EventAggregates.TRANSACTION;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
