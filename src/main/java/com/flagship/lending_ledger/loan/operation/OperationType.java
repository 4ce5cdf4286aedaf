package com.flagship.lending_ledger.loan.operation;

public enum OperationType {
    COLLATERAL_DEPOSIT,
    BORROW,
    REPAY,
    ADD_COLLATERAL,
    INTEREST_ACCRUAL,
    PARTIAL_LIQUIDATION,
    FULL_LIQUIDATION
}
