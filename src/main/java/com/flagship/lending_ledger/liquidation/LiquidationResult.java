package com.flagship.lending_ledger.liquidation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.loan.LoanStatus;
import com.flagship.lending_ledger.loan.operation.OperationType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Breakdown of one collateral sale against a loan.
 *
 * proceeds = debt_cleared + excess_proceeds. bad_debt_written_off is debt the sale could not
 * cover when it used up all the collateral.
 */
@Value
@Builder
public class LiquidationResult {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("liquidation_type")
    OperationType liquidationType;

    @JsonProperty("trigger")
    String trigger;

    @JsonProperty("collateral_sold")
    long collateralSold;

    @JsonProperty("proceeds")
    long proceeds;

    @JsonProperty("debt_cleared")
    long debtCleared;

    @JsonProperty("excess_proceeds")
    long excessProceeds;

    @JsonProperty("collateral_returned")
    long collateralReturned;

    @JsonProperty("bad_debt_written_off")
    long badDebtWrittenOff;

    @JsonProperty("minimum_interest_applied")
    long minimumInterestApplied;

    @JsonProperty("execution_rate")
    long executionRate;

    @JsonProperty("ltv_before")
    BigDecimal ltvBefore;

    @JsonProperty("ltv_after")
    BigDecimal ltvAfter;

    @JsonProperty("remaining_debt")
    long remainingDebt;

    @JsonProperty("remaining_collateral")
    long remainingCollateral;

    @JsonProperty("loan_status")
    LoanStatus loanStatus;

    public boolean isLoanClosed() {
        return loanStatus != LoanStatus.ACTIVE;
    }
}
