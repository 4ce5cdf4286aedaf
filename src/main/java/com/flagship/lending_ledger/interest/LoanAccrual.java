package com.flagship.lending_ledger.interest;

import lombok.Value;

import java.util.UUID;

/**
 * Result of accruing one loan for one day.
 */
@Value
public class LoanAccrual {
    UUID loanId;
    boolean accrued;
    long interest;

    static LoanAccrual skipped(UUID loanId) {
        return new LoanAccrual(loanId, false, 0L);
    }
}
