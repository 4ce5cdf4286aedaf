package com.flagship.lending_ledger.loan;

/**
 * Loan lifecycle states.
 *
 * ACTIVE is the only state that accepts mutations. REPAID and LIQUIDATED are terminal.
 */
public enum LoanStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED
}
