package com.flagship.bnpl_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bnpl_ledger.event.LedgerEvent;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox inside the caller's transaction.
 *
 * "If the balance change commits, its event is written." Publishing to Kafka happens
 * later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event in the current transaction. {@code MANDATORY} propagation makes calling
     * this outside a business transaction an error instead of a silently separate commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerEvent event) {
        String correlationId = CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null;
        OutboxEvent outboxEvent = OutboxEvent.create(event.getAggregateType(), event.getAggregateId(),
            event.getEventType(), serializePayload(event), correlationId);

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one aggregate in the order they were written (for auditing and tests).
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
