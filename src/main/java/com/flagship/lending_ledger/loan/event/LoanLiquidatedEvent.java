package com.flagship.lending_ledger.loan.event;

import com.flagship.lending_ledger.loan.Loan;
import com.flagship.lending_ledger.loan.operation.OperationType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when collateral is sold against a loan, whether the sale was partial or closed the loan.
 */
@Value
public class LoanLiquidatedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID accountId;
    OperationType liquidationType;
    String trigger;
    long debtCleared;
    long collateralSold;
    long collateralReturned;
    long executionRate;
    BigDecimal ltvBefore;
    long remainingDebt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanLiquidated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanLiquidatedEvent from(Loan loanAfter, OperationType liquidationType, String trigger,
                                           long debtCleared, long collateralSold, long collateralReturned,
                                           long executionRate, BigDecimal ltvBefore, Instant occurredAt) {
        return new LoanLiquidatedEvent(
            UUID.randomUUID(),
            loanAfter.getId(),
            loanAfter.getAccountId(),
            liquidationType,
            trigger,
            debtCleared,
            collateralSold,
            collateralReturned,
            executionRate,
            ltvBefore,
            loanAfter.getBorrowedAmount(),
            occurredAt
        );
    }
}
