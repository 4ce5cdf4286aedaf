package com.flagship.lending_ledger.observability;

import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.outbox.OutboxEventRepository;
import com.flagship.lending_ledger.rate.MarketRates;
import com.flagship.lending_ledger.rate.RateOracle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the lending ledger's dependencies.
 */
public class HealthIndicators {

    /**
     * DOWN without a fresh rate: every money-moving operation would be refused.
     */
    @Component("rateOracleHealth")
    public static class RateOracleHealthIndicator implements HealthIndicator {

        private final RateOracle rateOracle;

        public RateOracleHealthIndicator(RateOracle rateOracle) {
            this.rateOracle = rateOracle;
        }

        @Override
        public Health health() {
            try {
                MarketRates rates = rateOracle.currentRates();
                return Health.up()
                    .withDetail("sellRate", rates.getSellRate())
                    .withDetail("buyRate", rates.getBuyRate())
                    .withDetail("observedAt", rates.getObservedAt().toString())
                    .withDetail("source", rates.getSource())
                    .build();
            } catch (LendingException e) {
                return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
            }
        }
    }

    /**
     * Unhealthy if too many loan events are waiting to be published.
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
                return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
            }
        }
    }

    /**
     * Redis holds the rate snapshot; without it rates are read from the database.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Rates are read from the market_rates table while Redis is down";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                            .withDetail("response", result)
                            .build();
                    }
                    return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                        .withDetail("error", "No Kafka connections established")
                        .build();
                }
                return Health.up()
                    .withDetail("metricsCount", metrics.size())
                    .build();

            } catch (Exception e) {
                return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
            }
        }
    }
}
