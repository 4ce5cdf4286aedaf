package com.flagship.lending_ledger.loan.event;

import com.flagship.lending_ledger.loan.Loan;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a loan's LTV enters the warning band below the liquidation threshold.
 * Nothing about the loan changes; this is the owner's chance to add collateral or repay.
 */
@Value
public class LoanRiskWarningEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID accountId;
    BigDecimal currentLtv;
    BigDecimal warningThreshold;
    BigDecimal liquidationThreshold;
    long liquidationPrice;
    long sellRate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanRiskWarning";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanRiskWarningEvent from(Loan loan, BigDecimal currentLtv, BigDecimal warningThreshold,
                                            BigDecimal liquidationThreshold, long sellRate, Instant occurredAt) {
        return new LoanRiskWarningEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getAccountId(),
            currentLtv,
            warningThreshold,
            liquidationThreshold,
            loan.getLiquidationPrice(),
            sellRate,
            occurredAt
        );
    }
}
