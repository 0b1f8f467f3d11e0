package com.flagship.bnpl_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an inbound event handler at most once per consumer group.
 *
 * The handler runs in the same transaction that writes the processed-event row, so the ledger
 * change and the de-duplication record commit or roll back together. If the handler throws,
 * nothing is recorded and the exception propagates; the caller decides between redelivery and
 * {@link #recordFailure}.
 *
 * <pre>
 * eventProcessor.processEvent(eventId, eventType, "Settlement", settlementId, CONSUMER_GROUP,
 *     () -> settlementService.completeSettlement(settlementId, bankReference));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant())));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event as not relevant to this consumer so it is never looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, reason, clock.instant())));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    /**
     * Records a permanent rejection in its own transaction, after the handler's transaction
     * has rolled back.
     */
    @Transactional
    public void recordFailure(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                              String consumerGroup, String errorMessage) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.failed(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, errorMessage, clock.instant())));
        log.warn("Event {} rejected by consumer group {}: {}", eventId, consumerGroup, errorMessage);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
