package com.flagship.lending_ledger.loan.event;

import com.flagship.lending_ledger.loan.Loan;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a repayment clears a loan and its collateral is released.
 */
@Value
public class LoanRepaidEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    UUID accountId;
    long principal;
    long interestCharged;
    long minimumInterestApplied;
    long collateralReturned;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanRepaid";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanRepaidEvent from(Loan closedLoan, long minimumInterestApplied, long collateralReturned) {
        return new LoanRepaidEvent(
            UUID.randomUUID(),
            closedLoan.getId(),
            closedLoan.getAccountId(),
            closedLoan.getPrincipal(),
            closedLoan.getInterestAccrued(),
            minimumInterestApplied,
            collateralReturned,
            closedLoan.getClosedAt()
        );
    }
}
