package com.flagship.lending_ledger.liquidation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Summary of one risk monitor pass.
 */
@Value
@Builder
public class RiskTickResult {

    public enum Outcome {
        COMPLETED,
        SKIPPED_ALREADY_RUNNING,
        SKIPPED_RATE_UNAVAILABLE
    }

    @JsonProperty("outcome")
    Outcome outcome;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("duration_ms")
    long durationMs;

    @JsonProperty("sell_rate")
    Long sellRate;

    @JsonProperty("loans_checked")
    int loansChecked;

    @JsonProperty("warnings_raised")
    int warningsRaised;

    @JsonProperty("liquidations")
    @Singular
    List<LiquidationResult> liquidations;

    /** Loan ID to error message for loans that could not be checked */
    @JsonProperty("failures")
    @Singular
    Map<UUID, String> failures;

    static RiskTickResult skipped(Outcome outcome, Instant startedAt) {
        return RiskTickResult.builder()
            .outcome(outcome)
            .startedAt(startedAt)
            .build();
    }
}
