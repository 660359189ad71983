package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger's outbound dependencies.
 *
 * PostgreSQL is covered by Spring Boot's own datasource indicator.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Idempotency lookups fall back to the database";

    /**
     * Outbox backlog. Posting keeps working while Kafka is down, but events and
     * audit records pile up here.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

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
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage is reported as DEGRADED.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<RedisConnectionFactory> connectionFactory;

        public RedisHealthIndicator(ObjectProvider<RedisConnectionFactory> connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = connectionFactory.getIfAvailable();
            if (factory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = factory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;

        public KafkaHealthIndicator(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                return Health.down().withDetail("error", "KafkaTemplate not configured").build();
            }

            try {
                var metrics = template.metrics();
                return metrics != null && !metrics.isEmpty()
                        ? Health.up().withDetail("metricsCount", metrics.size()).build()
                        : Health.down().withDetail("error", "No Kafka producer connections established").build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
