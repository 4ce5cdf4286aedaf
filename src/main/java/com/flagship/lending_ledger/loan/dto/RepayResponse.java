package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.loan.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a repayment. minimum_interest_applied is the top-up charged when the
 * repayment closed the loan before the minimum interest period had been paid for.
 */
@Value
@Builder
public class RepayResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("repaid_amount")
    long repaidAmount;

    @JsonProperty("remaining_debt")
    long remainingDebt;

    @JsonProperty("loan_status")
    LoanStatus loanStatus;

    @JsonProperty("minimum_interest_applied")
    long minimumInterestApplied;

    @JsonProperty("collateral_returned")
    long collateralReturned;
}
