package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AddCollateralResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("added_amount")
    long addedAmount;

    @JsonProperty("new_total_collateral")
    long newTotalCollateral;

    @JsonProperty("new_ltv")
    BigDecimal newLtv;

    @JsonProperty("new_max_borrowable")
    long newMaxBorrowable;

    @JsonProperty("new_available_capacity")
    long newAvailableCapacity;

    @JsonProperty("new_liquidation_price")
    long newLiquidationPrice;
}
