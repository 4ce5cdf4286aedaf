package com.flagship.lending_ledger.liquidation;

import com.flagship.lending_ledger.loan.RiskStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What one risk check did to one loan.
 */
@Value
public class RiskEvaluation {

    public enum Outcome {
        /** Loan closed, emptied or repaid since it was listed */
        SKIPPED,
        SAFE,
        WARNING,
        LIQUIDATED
    }

    UUID loanId;
    Outcome outcome;
    RiskStatus riskStatus;
    BigDecimal currentLtv;
    boolean warningEmitted;
    LiquidationResult liquidation;

    static RiskEvaluation skipped(UUID loanId) {
        return new RiskEvaluation(loanId, Outcome.SKIPPED, null, null, false, null);
    }
}
