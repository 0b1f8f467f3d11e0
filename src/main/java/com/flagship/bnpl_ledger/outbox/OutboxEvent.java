package com.flagship.bnpl_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table.
 *
 * Written in the same database transaction as the balance change it describes, then
 * published to Kafka by {@link OutboxPublisher}. If the business transaction rolls back,
 * so does the event.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "Transaction", "Merchant"
    UUID aggregateId;
    String eventType;          // e.g. "InstallmentPaymentRecorded"
    String payload;            // JSON
    String correlationId;      // request that produced the event, may be null
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            correlationId, Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
