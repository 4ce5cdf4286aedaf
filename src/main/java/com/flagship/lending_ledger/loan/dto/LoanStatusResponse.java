package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.loan.LoanStatus;
import com.flagship.lending_ledger.loan.RiskStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Point-in-time view of an active loan, valued at the current sell rate.
 * Reading it never changes the loan.
 */
@Value
@Builder
public class LoanStatusResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("collateral_amount")
    long collateralAmount;

    @JsonProperty("collateral_value")
    BigDecimal collateralValue;

    @JsonProperty("borrowed_amount")
    long borrowedAmount;

    @JsonProperty("principal")
    long principal;

    @JsonProperty("interest_accrued")
    long interestAccrued;

    @JsonProperty("ltv_ratio")
    BigDecimal ltvRatio;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("current_ltv")
    BigDecimal currentLtv;

    @JsonProperty("max_borrowable")
    long maxBorrowable;

    @JsonProperty("available_capacity")
    long availableCapacity;

    @JsonProperty("liquidation_price")
    long liquidationPrice;

    @JsonProperty("risk_status")
    RiskStatus riskStatus;

    @JsonProperty("sell_rate")
    long sellRate;

    @JsonProperty("days_elapsed")
    long daysElapsed;

    @JsonProperty("minimum_interest_due")
    long minimumInterestDue;

    @JsonProperty("total_amount_due")
    long totalAmountDue;

    @JsonProperty("last_accrued_on")
    LocalDate lastAccruedOn;

    @JsonProperty("created_at")
    Instant createdAt;
}
