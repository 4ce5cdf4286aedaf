package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class BorrowResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("borrowed_amount")
    long borrowedAmount;

    @JsonProperty("new_borrowed_total")
    long newBorrowedTotal;

    @JsonProperty("available_capacity")
    long availableCapacity;

    @JsonProperty("liquidation_price")
    long liquidationPrice;
}
