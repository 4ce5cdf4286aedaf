package com.flagship.lending_ledger.rate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Rate oracle backed by the market-data feed's Redis snapshot, with the market_rates table as fallback.
 *
 * Strategy:
 * 1. Read the JSON snapshot from Redis (fast, can be unavailable)
 * 2. Fall back to the newest market_rates row
 * 3. Reject anything older than lending.rates.max-age
 *
 * Fails closed: with no fresh rate there is no valuation, so every money-moving
 * computation stops with RATE_UNAVAILABLE.
 */
@Service
@Slf4j
public class RedisRateOracle implements RateOracle {

    static final String SOURCE_REDIS = "redis";
    static final String SOURCE_DATABASE = "database";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final LendingProperties properties;
    private final Clock clock;

    public RedisRateOracle(Optional<StringRedisTemplate> redisTemplate,
                           JdbcTemplate jdbcTemplate,
                           ObjectMapper objectMapper,
                           LendingProperties properties,
                           Clock clock) {
        this.redisTemplate = redisTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public MarketRates currentRates() {
        Instant now = clock.instant();
        Duration maxAge = properties.getRates().getMaxAge();

        Optional<MarketRates> cached = readFromRedis();
        if (cached.isPresent() && cached.get().isFresh(now, maxAge)) {
            return cached.get();
        }

        Optional<MarketRates> stored = readFromDatabase();
        if (stored.isPresent() && stored.get().isFresh(now, maxAge)) {
            return stored.get();
        }

        Instant newest = newestObservation(cached, stored);
        throw new LendingException(LendingErrorCode.RATE_UNAVAILABLE,
            newest == null
                ? "No market rate has been published"
                : String.format("Newest market rate from %s is older than %s", newest, maxAge));
    }

    private Optional<MarketRates> readFromRedis() {
        if (!redisEnabled()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(properties.getRates().getRedisKey());
            if (json == null) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(json);
            return Optional.of(new MarketRates(
                node.path("buy_rate").asLong(),
                node.path("sell_rate").asLong(),
                Instant.parse(node.path("observed_at").asText()),
                SOURCE_REDIS));
        } catch (Exception e) {
            log.warn("Redis rate lookup failed, falling back to database: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<MarketRates> readFromDatabase() {
        try {
            List<MarketRates> rows = jdbcTemplate.query(
                "SELECT buy_rate, sell_rate, observed_at FROM market_rates ORDER BY observed_at DESC LIMIT 1",
                (rs, rowNum) -> new MarketRates(
                    rs.getLong("buy_rate"),
                    rs.getLong("sell_rate"),
                    rs.getTimestamp("observed_at").toInstant(),
                    SOURCE_DATABASE));
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new LendingException(LendingErrorCode.RATE_UNAVAILABLE,
                "Market rate lookup failed: " + e.getMessage(), e);
        }
    }

    private boolean redisEnabled() {
        return properties.getRates().isRedisEnabled() && redisTemplate.isPresent();
    }

    private static Instant newestObservation(Optional<MarketRates> first, Optional<MarketRates> second) {
        Instant newest = null;
        for (Optional<MarketRates> candidate : List.of(first, second)) {
            if (candidate.isPresent() && (newest == null || candidate.get().getObservedAt().isAfter(newest))) {
                newest = candidate.get().getObservedAt();
            }
        }
        return newest;
    }
}
