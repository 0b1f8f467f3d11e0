package com.flagship.bnpl_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bnpl_ledger.exception.BusinessRuleException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Consumes payout outcomes and completes or fails the matching withdrawal.
 *
 * Offsets are acknowledged manually. A message is acknowledged once it is processed, found to be
 * a duplicate, unparseable, or rejected by a business rule (unknown settlement, settlement already
 * final). Anything else, lock conflicts included, is rethrown so Kafka redelivers it.
 *
 * Handling runs under the correlation id the producer put in the record headers.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PayoutOutcomeConsumer {

    static final String CONSUMER_GROUP = "payout-outcome-consumer";
    private static final String AGGREGATE_TYPE = "Settlement";

    private final IdempotentEventProcessor eventProcessor;
    private final PayoutOutcomeHandler handler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payout-outcomes:payout-outcomes}",
        groupId = "${spring.kafka.consumer.group-id:bnpl-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.begin(correlationIdOf(record));
        try {
            log.debug("Received payout outcome: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

            PayoutOutcome outcome = parse(record.value());
            if (outcome == null) {
                log.warn("Could not parse payout outcome at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }
            CorrelationContext.putEntity(CorrelationContext.SETTLEMENT_ID_MDC_KEY, outcome.getSettlementId());

            try {
                boolean processed = route(outcome);
                if (processed) {
                    log.info("Processed {} for settlement {}", outcome.getEventType(), outcome.getSettlementId());
                }
            } catch (BusinessRuleException | IllegalArgumentException | ResourceNotFoundException e) {
                eventProcessor.recordFailure(outcome.getEventId(), outcome.getEventType(), AGGREGATE_TYPE,
                    outcome.getSettlementId(), CONSUMER_GROUP, e.getMessage());
            }
            ack.acknowledge();
        } finally {
            CorrelationContext.end();
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header == null || header.value() == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    private boolean route(PayoutOutcome outcome) {
        return switch (outcome.getEventType()) {
            case PayoutOutcome.PAYOUT_COMPLETED -> eventProcessor.processEvent(outcome.getEventId(),
                outcome.getEventType(), AGGREGATE_TYPE, outcome.getSettlementId(), CONSUMER_GROUP,
                () -> handler.onPayoutCompleted(outcome));
            case PayoutOutcome.PAYOUT_FAILED -> eventProcessor.processEvent(outcome.getEventId(),
                outcome.getEventType(), AGGREGATE_TYPE, outcome.getSettlementId(), CONSUMER_GROUP,
                () -> handler.onPayoutFailed(outcome));
            default -> {
                eventProcessor.skipEvent(outcome.getEventId(), outcome.getEventType(), AGGREGATE_TYPE,
                    outcome.getSettlementId(), CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private PayoutOutcome parse(String json) {
        try {
            PayoutOutcome outcome = objectMapper.readValue(json, PayoutOutcome.class);
            if (outcome.getEventId() == null || outcome.getSettlementId() == null || outcome.getEventType() == null) {
                log.warn("Payout outcome is missing eventId, eventType or settlementId: {}", json);
                return null;
            }
            return outcome;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse payout outcome: {}", e.getMessage());
            return null;
        }
    }
}
