package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class DepositCollateralResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("collateral_amount")
    long collateralAmount;

    @JsonProperty("ltv_ratio")
    BigDecimal ltvRatio;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("max_borrowable")
    long maxBorrowable;

    @JsonProperty("liquidation_price")
    long liquidationPrice;

    @JsonProperty("sell_rate")
    long sellRate;
}
