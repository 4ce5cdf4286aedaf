package com.flagship.lending_ledger.rate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_ledger.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores rate observations where {@link RedisRateOracle} reads them: the market_rates
 * table (durable) and the Redis snapshot (best effort).
 */
@Service
@Slf4j
public class MarketRateRecorder {

    private final Optional<StringRedisTemplate> redisTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final LendingProperties properties;
    private final Clock clock;

    public MarketRateRecorder(Optional<StringRedisTemplate> redisTemplate,
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

    @Transactional
    public MarketRates recordRates(long buyRate, long sellRate) {
        MarketRates rates = new MarketRates(buyRate, sellRate, clock.instant(), RedisRateOracle.SOURCE_DATABASE);
        jdbcTemplate.update(
            "INSERT INTO market_rates (buy_rate, sell_rate, observed_at) VALUES (?, ?, ?)",
            rates.getBuyRate(), rates.getSellRate(), Timestamp.from(rates.getObservedAt()));

        if (properties.getRates().isRedisEnabled() && redisTemplate.isPresent()) {
            try {
                Map<String, Object> snapshot = new LinkedHashMap<>();
                snapshot.put("buy_rate", rates.getBuyRate());
                snapshot.put("sell_rate", rates.getSellRate());
                snapshot.put("observed_at", rates.getObservedAt().toString());
                redisTemplate.get().opsForValue()
                    .set(properties.getRates().getRedisKey(), objectMapper.writeValueAsString(snapshot));
            } catch (Exception e) {
                log.warn("Failed to cache market rates in Redis: {}", e.getMessage());
            }
        }

        log.info("Recorded market rates: buy={}, sell={}", buyRate, sellRate);
        return rates;
    }
}
