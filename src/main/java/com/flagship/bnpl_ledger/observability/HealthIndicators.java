package com.flagship.bnpl_ledger.observability;

import com.flagship.bnpl_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger's supporting infrastructure.
 */
public class HealthIndicators {

    /**
     * Unhealthy when events pile up in the outbox (publisher stuck or Kafka down).
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the payment idempotency fast path, so an outage degrades
     * but does not take the ledger down.
     */
    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
