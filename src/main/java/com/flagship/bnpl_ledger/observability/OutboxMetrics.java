package com.flagship.bnpl_ledger.observability;

import com.flagship.bnpl_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges (backlog size, oldest event age, dead letters) and publish counters.
 *
 * Gauge values are cached and refreshed by {@link MetricsScheduler} so a scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_lettered.current", deadLetterCount, AtomicLong::get)
                .description("Events that exceeded max publish attempts")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());
            long age = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L);
            oldestEventAgeSeconds.set(age);
            deadLetterCount.set(outboxRepository.countDeadLettered(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    backlogSize.get(), age, deadLetterCount.get());
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long currentBacklog() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
