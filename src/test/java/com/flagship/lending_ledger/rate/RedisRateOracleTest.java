package com.flagship.lending_ledger.rate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Rate lookup order (Redis, then the market_rates table) and the freshness cut-off.
 */
@ExtendWith(MockitoExtension.class)
class RedisRateOracleTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final String REDIS_KEY = "market:rates:btc";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private LendingProperties properties;
    private RedisRateOracle rateOracle;

    @BeforeEach
    void setUp() {
        properties = new LendingProperties();
        rateOracle = new RedisRateOracle(Optional.of(redisTemplate), jdbcTemplate, new ObjectMapper(),
            properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenRedisSnapshot(long buy, long sell, Instant observedAt) {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(REDIS_KEY)).thenReturn(String.format(
            "{\"buy_rate\":%d,\"sell_rate\":%d,\"observed_at\":\"%s\"}", buy, sell, observedAt));
    }

    private void givenDatabaseRows(MarketRates... rows) {
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<MarketRates>>any()))
            .thenReturn(List.of(rows));
    }

    @Test
    @DisplayName("Fresh Redis snapshot is used without touching the database")
    void freshRedisSnapshot() {
        givenRedisSnapshot(9_200_000L, 9_000_000L, NOW.minusSeconds(30));

        MarketRates rates = rateOracle.currentRates();

        assertEquals(9_000_000L, rates.getSellRate());
        assertEquals(9_200_000L, rates.getBuyRate());
        assertEquals(RedisRateOracle.SOURCE_REDIS, rates.getSource());
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Stale Redis snapshot falls back to the newest stored rate")
    void staleRedisFallsBackToDatabase() {
        givenRedisSnapshot(9_200_000L, 9_000_000L, NOW.minus(Duration.ofHours(1)));
        givenDatabaseRows(new MarketRates(8_900_000L, 8_800_000L, NOW.minusSeconds(10),
            RedisRateOracle.SOURCE_DATABASE));

        MarketRates rates = rateOracle.currentRates();

        assertEquals(8_800_000L, rates.getSellRate());
        assertEquals(RedisRateOracle.SOURCE_DATABASE, rates.getSource());
    }

    @Test
    @DisplayName("Redis failure falls back to the database")
    void redisFailureFallsBack() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));
        givenDatabaseRows(new MarketRates(8_900_000L, 8_800_000L, NOW, RedisRateOracle.SOURCE_DATABASE));

        assertEquals(8_800_000L, rateOracle.currentRates().getSellRate());
    }

    @Test
    @DisplayName("No fresh rate anywhere fails with RATE_UNAVAILABLE")
    void noFreshRate() {
        givenRedisSnapshot(9_200_000L, 9_000_000L, NOW.minus(Duration.ofHours(2)));
        givenDatabaseRows(new MarketRates(8_900_000L, 8_800_000L, NOW.minus(Duration.ofHours(1)),
            RedisRateOracle.SOURCE_DATABASE));

        LendingException ex = assertThrows(LendingException.class, () -> rateOracle.currentRates());

        assertEquals(LendingErrorCode.RATE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    @DisplayName("Nothing published fails with RATE_UNAVAILABLE")
    void nothingPublished() {
        properties.getRates().setRedisEnabled(false);
        givenDatabaseRows();

        LendingException ex = assertThrows(LendingException.class, () -> rateOracle.currentRates());

        assertEquals(LendingErrorCode.RATE_UNAVAILABLE, ex.getErrorCode());
        verifyNoInteractions(redisTemplate);
    }
}
