package com.flagship.bnpl_ledger.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 100, updatable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "correlation_id", length = 64, updatable = false)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity fromDomain(OutboxEvent event) {
        return new OutboxEventEntity(
            event.getId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            event.getPayload(),
            event.getCorrelationId(),
            event.getCreatedAt(),
            event.getPublishedAt(),
            event.getRetryCount(),
            event.getLastError(),
            null // sequenceNumber - set by database
        );
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, correlationId,
            createdAt, publishedAt, retryCount, lastError, sequenceNumber);
    }

    void markPublished(Instant when) {
        this.publishedAt = when;
        this.lastError = null;
    }

    void markFailed(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage;
    }
}
