package com.flagship.bnpl_ledger.outbox;

import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Events go out in sequence order, keyed by aggregate id so that all events of one
 * transaction or merchant land on the same partition. A failed send bumps the retry count;
 * after {@code max-retries} the event stays in the table as a dead letter and is no longer polled.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.events:bnpl-events}")
    private String eventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(eventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        try {
            // Synchronous send keeps per-aggregate ordering
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
