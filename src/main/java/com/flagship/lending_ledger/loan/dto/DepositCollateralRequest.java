package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Opens a loan by pledging crypto. ltv_ratio is optional; the default_ltv_ratio setting applies without it.
 */
@Value
public class DepositCollateralRequest {

    @NotNull(message = "Crypto amount is required")
    @Positive(message = "Crypto amount must be greater than 0")
    @JsonProperty("crypto_amount")
    Long cryptoAmount;

    @DecimalMin(value = "0", inclusive = false, message = "LTV ratio must be greater than 0")
    @JsonProperty("ltv_ratio")
    BigDecimal ltvRatio;
}
