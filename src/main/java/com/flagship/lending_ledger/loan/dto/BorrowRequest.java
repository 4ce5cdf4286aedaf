package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Borrows against the account's active loan.
 */
@Value
@Builder
@Jacksonized
public class BorrowRequest {

    @NotNull(message = "Base amount is required")
    @Positive(message = "Base amount must be greater than 0")
    @JsonProperty("base_amount")
    Long baseAmount;
}
