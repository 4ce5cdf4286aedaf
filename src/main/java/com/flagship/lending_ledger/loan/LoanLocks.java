package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.account.AccountBalances;
import com.flagship.lending_ledger.account.AccountLedgerService;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Acquires row locks in the one order every lending path uses: account balances first,
 * then the loan. User operations, the accrual job and the risk monitor all come through
 * here, so they cannot deadlock on each other's lock order.
 */
@Component
@RequiredArgsConstructor
public class LoanLocks {

    private final AccountLedgerService accountLedgerService;
    private final LoanPersistenceService loanPersistenceService;

    @Transactional(propagation = Propagation.MANDATORY)
    public AccountBalances lockAccount(UUID accountId) {
        return accountLedgerService.lockBalances(accountId);
    }

    /**
     * Locks the account and its ACTIVE loan.
     *
     * @throws LendingException NO_ACTIVE_LOAN if the account has none
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LockedLoan lockActiveLoanOf(UUID accountId) {
        AccountBalances balances = accountLedgerService.lockBalances(accountId);
        Loan loan = loanPersistenceService.lockActiveLoan(accountId)
            .orElseThrow(() -> new LendingException(LendingErrorCode.NO_ACTIVE_LOAN,
                "Account " + accountId + " has no active loan"));
        return new LockedLoan(balances, loan);
    }

    /**
     * Locks a loan by ID together with its owner's account. The loan may be in any state;
     * callers check it is still ACTIVE now that they hold the lock.
     *
     * @throws LendingException LOAN_NOT_FOUND if no such loan exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LockedLoan lockLoan(UUID loanId) {
        UUID accountId = loanPersistenceService.findAccountId(loanId)
            .orElseThrow(() -> loanNotFound(loanId));
        AccountBalances balances = accountLedgerService.lockBalances(accountId);
        Optional<Loan> loan = loanPersistenceService.lockLoan(loanId);
        return new LockedLoan(balances, loan.orElseThrow(() -> loanNotFound(loanId)));
    }

    private static LendingException loanNotFound(UUID loanId) {
        return new LendingException(LendingErrorCode.LOAN_NOT_FOUND, "Loan not found: " + loanId);
    }
}
