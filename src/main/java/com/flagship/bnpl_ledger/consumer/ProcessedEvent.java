package com.flagship.bnpl_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an inbound event, so redelivery is a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        /** Rejected by a business rule; the event is not retried. */
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, now,
            ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, now,
            ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        UUID aggregateId, String consumerGroup, String errorMessage, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, now,
            ProcessingResult.FAILED, errorMessage);
    }
}
