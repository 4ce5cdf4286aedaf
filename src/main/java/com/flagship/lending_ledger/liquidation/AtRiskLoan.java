package com.flagship.lending_ledger.liquidation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.loan.RiskStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AtRiskLoan {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("collateral_amount")
    long collateralAmount;

    @JsonProperty("borrowed_amount")
    long borrowedAmount;

    @JsonProperty("liquidation_price")
    long liquidationPrice;

    @JsonProperty("sell_rate")
    long sellRate;

    @JsonProperty("current_ltv")
    BigDecimal currentLtv;

    @JsonProperty("risk_status")
    RiskStatus riskStatus;
}
