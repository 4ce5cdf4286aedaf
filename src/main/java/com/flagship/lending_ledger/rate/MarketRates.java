package com.flagship.lending_ledger.rate;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Buy and sell rates in base units per one whole crypto unit, as observed at a point in time.
 * Collateral is always valued at the sell rate.
 */
@Value
public class MarketRates {
    @JsonProperty("buy_rate")
    long buyRate;

    @JsonProperty("sell_rate")
    long sellRate;

    @JsonProperty("observed_at")
    Instant observedAt;

    @JsonProperty("source")
    String source;

    public MarketRates(long buyRate, long sellRate, Instant observedAt, String source) {
        if (buyRate <= 0 || sellRate <= 0) {
            throw new IllegalArgumentException(
                String.format("Rates must be positive: buy=%d, sell=%d", buyRate, sellRate));
        }
        if (observedAt == null) {
            throw new IllegalArgumentException("Rate observation time is required");
        }
        this.buyRate = buyRate;
        this.sellRate = sellRate;
        this.observedAt = observedAt;
        this.source = source;
    }

    public boolean isFresh(Instant now, Duration maxAge) {
        return !observedAt.plus(maxAge).isBefore(now);
    }
}
