package com.flagship.lending_ledger.interest;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate of one interest accrual run.
 */
@Value
@Builder
public class AccrualRunResult {

    @JsonProperty("accrual_date")
    LocalDate accrualDate;

    @JsonProperty("loans_considered")
    int loansConsidered;

    @JsonProperty("loans_accrued")
    int loansAccrued;

    @JsonProperty("loans_skipped")
    int loansSkipped;

    @JsonProperty("loans_failed")
    int loansFailed;

    @JsonProperty("total_interest")
    long totalInterest;

    @JsonProperty("duration_ms")
    long durationMs;

    @JsonProperty("failures")
    @Singular
    Map<UUID, String> failures;
}
