package com.flagship.lending_ledger.interest;

import com.flagship.lending_ledger.account.AccountLedgerService;
import com.flagship.lending_ledger.loan.Loan;
import com.flagship.lending_ledger.loan.LoanPersistenceService;
import com.flagship.lending_ledger.loan.RepaymentQuote;
import com.flagship.lending_ledger.loan.operation.LoanOperation;
import com.flagship.lending_ledger.loan.operation.LoanOperationLog;
import com.flagship.lending_ledger.loan.operation.OperationType;
import com.flagship.lending_ledger.observability.LendingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Posts interest to a locked loan: the loan's balance, the account's debt and interest
 * mirrors, and an INTEREST_ACCRUAL record, all in the caller's transaction.
 *
 * Used by the daily accrual and by the minimum-interest top-up that repayment and
 * liquidation apply before closing a loan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterestPostingService {

    static final String REASON_DAILY = "daily_accrual";
    static final String REASON_MINIMUM = "minimum_interest_top_up";

    private final LoanPersistenceService loanPersistenceService;
    private final AccountLedgerService accountLedgerService;
    private final LoanOperationLog operationLog;
    private final LendingMetrics lendingMetrics;

    /**
     * Charges one day of interest on the outstanding balance and stamps the accrual date.
     * A zero charge still moves the date so the day is not charged twice.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan postDailyInterest(Loan loan, long amount, LocalDate accrualDate,
                                  BigDecimal liquidationThreshold, Instant now) {
        Loan updated = loanPersistenceService.update(
            loan.chargeInterest(amount, accrualDate, liquidationThreshold, now));
        if (amount > 0) {
            accountLedgerService.chargeInterest(loan.getAccountId(), amount);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", REASON_DAILY);
            details.put("accrual_date", accrualDate.toString());
            details.put("balance_before", loan.getBorrowedAmount());
            details.put("interest_rate", loan.getInterestRate());
            append(updated, amount, details, now);
            lendingMetrics.recordInterestAccrued(amount);
        }
        return updated;
    }

    /**
     * Charges the shortfall between the minimum interest owed and the interest charged so far.
     * Leaves the accrual date alone.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan postMinimumInterest(Loan loan, RepaymentQuote quote,
                                    BigDecimal liquidationThreshold, Instant now) {
        if (!quote.requiresTopUp()) {
            return loan;
        }
        long shortfall = quote.getInterestShortfall();
        Loan updated = loanPersistenceService.update(
            loan.chargeInterest(shortfall, null, liquidationThreshold, now));
        accountLedgerService.chargeInterest(loan.getAccountId(), shortfall);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", REASON_MINIMUM);
        details.put("days_elapsed", quote.getDaysElapsed());
        details.put("days_charged", quote.getDaysCharged());
        details.put("minimum_interest_due", quote.getMinimumInterestDue());
        details.put("interest_already_charged", quote.getInterestAccrued());
        append(updated, shortfall, details, now);
        lendingMetrics.recordInterestAccrued(shortfall);

        log.info("Applied minimum interest top-up: loanId={}, shortfall={}, daysCharged={}",
            loan.getId(), shortfall, quote.getDaysCharged());
        return updated;
    }

    private void append(Loan loan, long amount, Map<String, Object> details, Instant now) {
        operationLog.append(LoanOperation.builder()
            .id(UUID.randomUUID())
            .loanId(loan.getId())
            .accountId(loan.getAccountId())
            .type(OperationType.INTEREST_ACCRUAL)
            .baseAmount(amount)
            .cryptoAmount(0L)
            .details(details)
            .createdAt(now)
            .build());
    }
}
