package com.flagship.lending_ledger.loan;

/**
 * Risk band of a loan at the current sell rate.
 */
public enum RiskStatus {
    SAFE,
    WARNING,
    LIQUIDATE
}
