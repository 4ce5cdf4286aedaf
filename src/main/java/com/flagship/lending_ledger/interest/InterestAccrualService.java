package com.flagship.lending_ledger.interest;

import com.flagship.lending_ledger.loan.Loan;
import com.flagship.lending_ledger.loan.LoanLocks;
import com.flagship.lending_ledger.loan.LoanMath;
import com.flagship.lending_ledger.settings.LendingSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily interest for a single loan, in its own transaction under the account and loan locks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterestAccrualService {

    private final LoanLocks loanLocks;
    private final InterestPostingService interestPostingService;
    private final Clock clock;

    /**
     * Charges one day of interest on the loan's outstanding balance for the given date.
     * A loan already accrued for that date, closed, or without debt is skipped, so
     * running the job twice on one day charges nothing the second time.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public LoanAccrual accrue(UUID loanId, LocalDate accrualDate, LendingSettings settings) {
        Loan loan = loanLocks.lockLoan(loanId).getLoan();
        if (!loan.isActive() || loan.getBorrowedAmount() <= 0) {
            return LoanAccrual.skipped(loanId);
        }
        if (loan.getLastAccruedOn() != null && !loan.getLastAccruedOn().isBefore(accrualDate)) {
            log.debug("Loan {} already accrued for {}", loanId, loan.getLastAccruedOn());
            return LoanAccrual.skipped(loanId);
        }

        long interest = LoanMath.dailyInterest(loan.getBorrowedAmount(), loan.getInterestRate());
        Loan updated = interestPostingService.postDailyInterest(
            loan, interest, accrualDate, settings.getLiquidationThreshold(), clock.instant());

        log.debug("Accrued interest: loanId={}, interest={}, balance={}", loanId, interest, updated.getBorrowedAmount());
        return new LoanAccrual(loanId, true, interest);
    }
}
