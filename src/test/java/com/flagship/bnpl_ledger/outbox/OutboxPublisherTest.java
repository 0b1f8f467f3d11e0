package com.flagship.bnpl_ledger.outbox;

import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.event.EventAggregates;
import com.flagship.bnpl_ledger.event.PurchaseAcceptedEvent;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.observability.OutboxMetrics;
import com.flagship.bnpl_ledger.orchestration.AcceptanceResult;
import com.flagship.bnpl_ledger.payment.PaymentMethod;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Outbox publisher against a real broker, plus the retry path against a failing template.
 */
class OutboxPublisherTest extends IntegrationTestSupport {

    private static final String TOPIC = "bnpl-events-test";

    static final KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private OutboxMetrics outboxMetrics;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUpConsumer() {
        if (!kafka.isRunning()) {
            kafka.start();
        }
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(TOPIC));
    }

    @AfterEach
    void closeConsumer() {
        if (consumer != null) {
            consumer.close();
        }
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Published events reach the topic keyed by aggregate id and are marked published")
    void testPublishesToKafka() {
        printTestHeader("Publisher sends events to Kafka");
        CorrelationContext.setCorrelationId("corr-publisher-test");
        AcceptanceResult result = accepted(merchant(), customer("5000.00"), "1200.00", 3);
        CorrelationContext.clear();
        UUID transactionId = result.getTransaction().getId();

        OutboxPublisher publisher = publisher(realTemplate(), 5);
        publisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished());

        List<ConsumerRecord<String, String>> received = pollForKey(transactionId, 1);
        ConsumerRecord<String, String> accepted = received.stream()
            .filter(r -> PurchaseAcceptedEvent.EVENT_TYPE.equals(header(r, OutboxPublisher.EVENT_TYPE_HEADER)))
            .findFirst()
            .orElseThrow();
        printOutput("Record", accepted.value());

        assertEquals(transactionId.toString(), accepted.key());
        assertEquals("corr-publisher-test", header(accepted, CorrelationContext.CORRELATION_ID_HEADER));
        assertTrue(accepted.value().contains(transactionId.toString()));
        printSuccess("Event published and marked");
    }

    @Test
    @DisplayName("Send failures increment the retry count until the event is dead-lettered")
    void testFailedSendsDeadLetter() {
        Customer customer = customer("1000.00");
        purchase(merchant(), customer, 1, "50.00");

        @SuppressWarnings("unchecked")
        KafkaTemplate<String, String> failing = mock(KafkaTemplate.class);
        when(failing.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker unavailable")));

        OutboxPublisher publisher = publisher(failing, 2);
        publisher.triggerPublish();
        publisher.triggerPublish();
        publisher.triggerPublish();

        OutboxEventEntity stored = outboxEventRepository.findAll().get(0);
        assertEquals(2, stored.getRetryCount());
        assertNull(stored.getPublishedAt());
        assertTrue(stored.getLastError().contains("broker unavailable"));
        assertTrue(outboxService.findUnpublishedEvents(10, 2).isEmpty());
    }

    @Test
    @DisplayName("Events of one aggregate are published in sequence order")
    void testPerAggregateOrdering() {
        AcceptanceResult result = accepted(merchant(), customer("5000.00"), "900.00", 3);
        UUID transactionId = result.getTransaction().getId();
        UUID customerId = result.getTransaction().getCustomerId();
        ledger.makePayment(transactionId, customerId, money("300.00"), PaymentMethod.CARD, "order-key-1");
        clock.advance(Duration.ofMinutes(1));
        ledger.makePayment(transactionId, customerId, money("600.00"), PaymentMethod.WALLET, "order-key-2");

        List<OutboxEvent> expected = outboxService.getEventsForAggregate(EventAggregates.TRANSACTION, transactionId);

        publisher(realTemplate(), 5).triggerPublish();

        List<String> published = pollForKey(transactionId, expected.size()).stream()
            .map(r -> header(r, OutboxPublisher.EVENT_TYPE_HEADER))
            .toList();
        assertEquals(expected.stream().map(OutboxEvent::getEventType).toList(), published);
    }

    private OutboxPublisher publisher(KafkaTemplate<String, String> template, int maxRetries) {
        OutboxPublisher publisher = new OutboxPublisher(outboxService, template, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "eventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", maxRetries);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 10_000L);
        return publisher;
    }

    private KafkaTemplate<String, String> realTemplate() {
        Map<String, Object> props = Map.of(
            ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers(),
            ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
            ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        return new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(props));
    }

    /**
     * The topic outlives a single test, so only records keyed by {@code aggregateId} count.
     */
    private List<ConsumerRecord<String, String>> pollForKey(UUID aggregateId, int count) {
        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 20_000;
        while (received.size() < count && System.currentTimeMillis() < deadline) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
            for (ConsumerRecord<String, String> record : records) {
                if (aggregateId.toString().equals(record.key())) {
                    received.add(record);
                }
            }
        }
        return received;
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
