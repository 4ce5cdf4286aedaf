package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pledges more crypto to the account's active loan.
 */
@Value
@Builder
@Jacksonized
public class AddCollateralRequest {

    @NotNull(message = "Crypto amount is required")
    @Positive(message = "Crypto amount must be greater than 0")
    @JsonProperty("crypto_amount")
    Long cryptoAmount;
}
