package com.flagship.bnpl_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of {@code processed_events}. Uniqueness is on (event_id, consumer_group), so two
 * groups can each process the same event.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        return new ProcessedEventEntity(
            UUID.randomUUID(),
            event.getEventId(),
            event.getEventType(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getConsumerGroup(),
            event.getProcessedAt(),
            event.getResult(),
            event.getErrorMessage()
        );
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            processedAt, processingResult, errorMessage);
    }
}
