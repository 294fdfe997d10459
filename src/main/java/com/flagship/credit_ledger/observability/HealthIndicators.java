package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.outbox.OutboxEventRepository;
import com.flagship.credit_ledger.outbox.OutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the dependencies around the ledger.
 *
 * Redis is optional (issuance idempotency falls back to the database), so its failure
 * reports DEGRADED rather than DOWN.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Idempotency lookups fall back to the credits table";

    /**
     * Outbox backlog: WARNING above the warning threshold, DOWN above the critical one.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final OutboxService outboxService;
        private final long warningThreshold;
        private final long criticalThreshold;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     OutboxService outboxService,
                                     @Value("${outbox.health.warning-threshold:1000}") long warningThreshold,
                                     @Value("${outbox.health.critical-threshold:10000}") long criticalThreshold) {
            this.outboxRepository = outboxRepository;
            this.outboxService = outboxService;
            this.warningThreshold = warningThreshold;
            this.criticalThreshold = criticalThreshold;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(outboxService.getMaxRetries());

                Health.Builder builder = backlogSize < warningThreshold
                        ? Health.up()
                        : backlogSize < criticalThreshold
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", warningThreshold)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", REDIS_FALLBACK_NOTE)
                    .build();
        }
    }

    /**
     * Reports UP once the producer has established connections.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final String topic;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    @Value("${kafka.topic.credits:credit-events}") String topic) {
            this.kafkaTemplate = kafkaTemplate;
            this.topic = topic;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("topic", topic)
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("topic", topic)
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("topic", topic).withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
