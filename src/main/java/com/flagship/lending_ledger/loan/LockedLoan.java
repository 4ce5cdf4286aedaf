package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.account.AccountBalances;
import lombok.Value;

/**
 * A loan and its owner's balances, both row-locked in the current transaction.
 */
@Value
public class LockedLoan {
    AccountBalances balances;
    Loan loan;
}
