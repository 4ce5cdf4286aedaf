package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.account.AccountBalances;
import com.flagship.lending_ledger.account.AccountLedgerService;
import com.flagship.lending_ledger.interest.InterestPostingService;
import com.flagship.lending_ledger.loan.dto.AddCollateralResponse;
import com.flagship.lending_ledger.loan.dto.BorrowResponse;
import com.flagship.lending_ledger.loan.dto.DepositCollateralResponse;
import com.flagship.lending_ledger.loan.dto.LoanOperationResponse;
import com.flagship.lending_ledger.loan.dto.LoanStatusResponse;
import com.flagship.lending_ledger.loan.dto.RepayResponse;
import com.flagship.lending_ledger.loan.event.LoanRepaidEvent;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.loan.operation.LoanOperation;
import com.flagship.lending_ledger.loan.operation.LoanOperationLog;
import com.flagship.lending_ledger.loan.operation.OperationType;
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LendingMetrics;
import com.flagship.lending_ledger.outbox.OutboxService;
import com.flagship.lending_ledger.rate.MarketRates;
import com.flagship.lending_ledger.rate.RateOracle;
import com.flagship.lending_ledger.settings.LendingSettings;
import com.flagship.lending_ledger.settings.LendingSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * User-facing loan operations: open a loan against collateral, borrow, repay,
 * add collateral, and read status and history.
 *
 * Every money-moving operation is one transaction that:
 * 1. Reads the settings and (where collateral is valued) a fresh rate, failing closed
 * 2. Locks the account's balance row, then its loan row
 * 3. Validates against the locked state
 * 4. Writes the loan, the balance buckets, the operation record and any event together
 *
 * Transient database failures (deadlock victim, serialization failure) are retried
 * as a whole transaction; business rule violations are not.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LendingEngine {

    private final LoanLocks loanLocks;
    private final LoanPersistenceService loanPersistenceService;
    private final AccountLedgerService accountLedgerService;
    private final InterestPostingService interestPostingService;
    private final LoanOperationLog operationLog;
    private final OutboxService outboxService;
    private final LendingSettingsService settingsService;
    private final RateOracle rateOracle;
    private final LendingMetrics lendingMetrics;
    private final Clock clock;

    /**
     * Opens a loan by moving crypto from available to collateral.
     *
     * @param requestedLtv LTV ratio for this loan, or null for the default_ltv_ratio setting
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public DepositCollateralResponse depositCollateral(UUID accountId, long cryptoAmount, BigDecimal requestedLtv) {
        return instrumented("deposit_collateral", accountId, () -> {
            requirePositive(cryptoAmount, "Collateral amount");
            LendingSettings settings = settingsService.current();
            BigDecimal ltvRatio = requestedLtv != null ? requestedLtv : settings.getDefaultLtvRatio();
            if (ltvRatio.signum() <= 0 || ltvRatio.compareTo(settings.getLiquidationThreshold()) >= 0) {
                throw new IllegalArgumentException(String.format(
                    "LTV ratio must be above 0 and below the liquidation threshold %s: %s",
                    settings.getLiquidationThreshold(), ltvRatio));
            }
            MarketRates rates = currentRates("deposit_collateral");

            AccountBalances balances = loanLocks.lockAccount(accountId);
            if (loanPersistenceService.lockActiveLoan(accountId).isPresent()) {
                throw new LendingException(LendingErrorCode.LOAN_ALREADY_ACTIVE,
                    "Account " + accountId + " already has an active loan");
            }
            if (balances.getAvailableCrypto() < cryptoAmount) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_FUNDS,
                    "Available crypto %d is less than the %d requested as collateral",
                    balances.getAvailableCrypto(), cryptoAmount);
            }

            Instant now = clock.instant();
            Loan loan = loanPersistenceService.create(
                Loan.open(accountId, cryptoAmount, ltvRatio, settings.getInterestRate(), now));
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());
            accountLedgerService.pledgeCollateral(accountId, cryptoAmount);

            long maxBorrowable = LoanMath.maxBorrowable(cryptoAmount, rates.getSellRate(), ltvRatio);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("ltv_ratio", ltvRatio);
            details.put("interest_rate", settings.getInterestRate());
            details.put("max_borrowable", maxBorrowable);
            appendOperation(loan, OperationType.COLLATERAL_DEPOSIT, 0L, cryptoAmount,
                rates.getSellRate(), details, now);

            log.info("Loan opened: loanId={}, collateral={}, ltvRatio={}, maxBorrowable={}",
                loan.getId(), cryptoAmount, ltvRatio, maxBorrowable);

            return DepositCollateralResponse.builder()
                .loanId(loan.getId())
                .collateralAmount(loan.getCollateralAmount())
                .ltvRatio(loan.getLtvRatio())
                .interestRate(loan.getInterestRate())
                .maxBorrowable(maxBorrowable)
                .liquidationPrice(loan.getLiquidationPrice())
                .sellRate(rates.getSellRate())
                .build();
        });
    }

    /**
     * Borrows base currency against the active loan, up to its remaining capacity.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public BorrowResponse borrow(UUID accountId, long amount) {
        return instrumented("borrow", accountId, () -> {
            requirePositive(amount, "Borrow amount");
            LendingSettings settings = settingsService.current();
            MarketRates rates = currentRates("borrow");

            Loan loan = loanLocks.lockActiveLoanOf(accountId).getLoan();
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());

            long maxBorrowable = LoanMath.maxBorrowable(
                loan.getCollateralAmount(), rates.getSellRate(), loan.getLtvRatio());
            long capacity = maxBorrowable - loan.getBorrowedAmount();
            if (amount > capacity) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_CAPACITY,
                    "Requested %d exceeds available capacity %d", amount, Math.max(0L, capacity));
            }

            Instant now = clock.instant();
            Loan updated = loanPersistenceService.update(
                loan.borrow(amount, settings.getLiquidationThreshold(), now));
            accountLedgerService.disburseLoan(accountId, amount);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("max_borrowable", maxBorrowable);
            details.put("borrowed_before", loan.getBorrowedAmount());
            details.put("borrowed_after", updated.getBorrowedAmount());
            appendOperation(updated, OperationType.BORROW, amount, 0L, rates.getSellRate(), details, now);

            log.info("Borrowed: loanId={}, amount={}, borrowedTotal={}, remainingCapacity={}",
                updated.getId(), amount, updated.getBorrowedAmount(), maxBorrowable - updated.getBorrowedAmount());

            return BorrowResponse.builder()
                .loanId(updated.getId())
                .borrowedAmount(amount)
                .newBorrowedTotal(updated.getBorrowedAmount())
                .availableCapacity(Math.max(0L, maxBorrowable - updated.getBorrowedAmount()))
                .liquidationPrice(updated.getLiquidationPrice())
                .build();
        });
    }

    /**
     * Repays the active loan from available base currency.
     *
     * A repayment that covers the whole amount due closes the loan: if the interest charged
     * so far is below the minimum-interest floor, the shortfall is charged first and is part
     * of the amount due. All collateral is then returned.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public RepayResponse repay(UUID accountId, long amount) {
        return instrumented("repay", accountId, () -> {
            requirePositive(amount, "Repay amount");
            LendingSettings settings = settingsService.current();

            LockedLoan locked = loanLocks.lockActiveLoanOf(accountId);
            Loan loan = locked.getLoan();
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());
            if (loan.getBorrowedAmount() == 0) {
                throw new LendingException(LendingErrorCode.NO_OUTSTANDING_DEBT,
                    "Loan " + loan.getId() + " has nothing to repay");
            }

            Instant now = clock.instant();
            RepaymentQuote quote = loan.quoteRepayment(now, settings.getMinimumInterestDays());
            if (amount > quote.getTotalAmountDue()) {
                throw LendingException.of(LendingErrorCode.EXCEEDS_OUTSTANDING_DEBT,
                    "Repayment %d exceeds the total amount due %d", amount, quote.getTotalAmountDue());
            }
            boolean closing = amount == quote.getTotalAmountDue();
            if (!closing && amount >= loan.getBorrowedAmount()) {
                throw LendingException.of(LendingErrorCode.MINIMUM_INTEREST_NOT_MET,
                    "Closing this loan requires %d including minimum interest of %d for %d days",
                    quote.getTotalAmountDue(), quote.getMinimumInterestDue(), quote.getDaysCharged());
            }
            if (locked.getBalances().getAvailableBase() < amount) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_FUNDS,
                    "Available base %d is less than the repayment %d",
                    locked.getBalances().getAvailableBase(), amount);
            }

            long minimumInterestApplied = 0L;
            if (closing && quote.requiresTopUp()) {
                loan = interestPostingService.postMinimumInterest(
                    loan, quote, settings.getLiquidationThreshold(), now);
                minimumInterestApplied = quote.getInterestShortfall();
            }

            Loan updated = loanPersistenceService.update(
                loan.repay(amount, settings.getLiquidationThreshold(), now));
            accountLedgerService.applyRepayment(accountId, amount);

            long collateralReturned = 0L;
            if (updated.getStatus() == LoanStatus.REPAID) {
                collateralReturned = loan.getCollateralAmount();
                accountLedgerService.releaseCollateral(accountId, collateralReturned);
                accountLedgerService.clearLoanPosition(accountId);
                outboxService.saveEvent(LoanRepaidEvent.from(updated, minimumInterestApplied, collateralReturned));
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("remaining_debt", updated.getBorrowedAmount());
            details.put("loan_status", updated.getStatus().name());
            details.put("total_amount_due", quote.getTotalAmountDue());
            details.put("days_charged", quote.getDaysCharged());
            details.put("minimum_interest_applied", minimumInterestApplied);
            appendOperation(updated, OperationType.REPAY, amount, collateralReturned, null, details, now);

            log.info("Repayment applied: loanId={}, amount={}, remainingDebt={}, status={}, collateralReturned={}",
                updated.getId(), amount, updated.getBorrowedAmount(), updated.getStatus(), collateralReturned);

            return RepayResponse.builder()
                .loanId(updated.getId())
                .repaidAmount(amount)
                .remainingDebt(updated.getBorrowedAmount())
                .loanStatus(updated.getStatus())
                .minimumInterestApplied(minimumInterestApplied)
                .collateralReturned(collateralReturned)
                .build();
        });
    }

    /**
     * Pledges more crypto to the active loan, lowering its LTV and liquidation price.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public AddCollateralResponse addCollateral(UUID accountId, long cryptoAmount) {
        return instrumented("add_collateral", accountId, () -> {
            requirePositive(cryptoAmount, "Collateral amount");
            LendingSettings settings = settingsService.current();
            MarketRates rates = currentRates("add_collateral");

            LockedLoan locked = loanLocks.lockActiveLoanOf(accountId);
            Loan loan = locked.getLoan();
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());
            if (locked.getBalances().getAvailableCrypto() < cryptoAmount) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_FUNDS,
                    "Available crypto %d is less than the %d requested as collateral",
                    locked.getBalances().getAvailableCrypto(), cryptoAmount);
            }

            Instant now = clock.instant();
            Loan updated = loanPersistenceService.update(
                loan.addCollateral(cryptoAmount, settings.getLiquidationThreshold(), now));
            accountLedgerService.pledgeCollateral(accountId, cryptoAmount);

            BigDecimal newLtv = LoanMath.currentLtv(
                updated.getBorrowedAmount(), updated.getCollateralAmount(), rates.getSellRate());
            long maxBorrowable = LoanMath.maxBorrowable(
                updated.getCollateralAmount(), rates.getSellRate(), updated.getLtvRatio());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("collateral_before", loan.getCollateralAmount());
            details.put("collateral_after", updated.getCollateralAmount());
            details.put("ltv_after", newLtv);
            appendOperation(updated, OperationType.ADD_COLLATERAL, 0L, cryptoAmount,
                rates.getSellRate(), details, now);

            log.info("Collateral added: loanId={}, amount={}, totalCollateral={}, ltv={}",
                updated.getId(), cryptoAmount, updated.getCollateralAmount(), newLtv);

            return AddCollateralResponse.builder()
                .loanId(updated.getId())
                .addedAmount(cryptoAmount)
                .newTotalCollateral(updated.getCollateralAmount())
                .newLtv(newLtv)
                .newMaxBorrowable(maxBorrowable)
                .newAvailableCapacity(Math.max(0L, maxBorrowable - updated.getBorrowedAmount()))
                .newLiquidationPrice(updated.getLiquidationPrice())
                .build();
        });
    }

    /**
     * Values the active loan at the current sell rate. Takes no locks and writes nothing.
     */
    @Transactional(readOnly = true)
    public LoanStatusResponse getStatus(UUID accountId) {
        Loan loan = loanPersistenceService.findActiveLoan(accountId)
            .orElseThrow(() -> new LendingException(LendingErrorCode.NO_ACTIVE_LOAN,
                "Account " + accountId + " has no active loan"));
        LendingSettings settings = settingsService.current();
        MarketRates rates = currentRates("get_status");
        long sellRate = rates.getSellRate();

        BigDecimal currentLtv = LoanMath.currentLtv(loan.getBorrowedAmount(), loan.getCollateralAmount(), sellRate);
        long maxBorrowable = LoanMath.maxBorrowable(loan.getCollateralAmount(), sellRate, loan.getLtvRatio());
        RepaymentQuote quote = loan.quoteRepayment(clock.instant(), settings.getMinimumInterestDays());

        return LoanStatusResponse.builder()
            .loanId(loan.getId())
            .accountId(loan.getAccountId())
            .status(loan.getStatus())
            .collateralAmount(loan.getCollateralAmount())
            .collateralValue(LoanMath.collateralValue(loan.getCollateralAmount(), sellRate))
            .borrowedAmount(loan.getBorrowedAmount())
            .principal(loan.getPrincipal())
            .interestAccrued(loan.getInterestAccrued())
            .ltvRatio(loan.getLtvRatio())
            .interestRate(loan.getInterestRate())
            .currentLtv(currentLtv)
            .maxBorrowable(maxBorrowable)
            .availableCapacity(Math.max(0L, maxBorrowable - loan.getBorrowedAmount()))
            .liquidationPrice(loan.getLiquidationPrice())
            .riskStatus(LoanMath.riskStatus(loan.getBorrowedAmount(), loan.getCollateralAmount(), sellRate,
                settings.getWarningThreshold(), settings.getLiquidationThreshold()))
            .sellRate(sellRate)
            .daysElapsed(quote.getDaysElapsed())
            .minimumInterestDue(quote.getMinimumInterestDue())
            .totalAmountDue(quote.getTotalAmountDue())
            .lastAccruedOn(loan.getLastAccruedOn())
            .createdAt(loan.getCreatedAt())
            .build();
    }

    /**
     * Operation records of the account, newest first, optionally narrowed to one loan.
     */
    @Transactional(readOnly = true)
    public List<LoanOperationResponse> getHistory(UUID accountId, UUID loanId) {
        return operationLog.history(accountId, loanId).stream()
            .map(LoanOperationResponse::from)
            .toList();
    }

    private MarketRates currentRates(String operation) {
        try {
            return rateOracle.currentRates();
        } catch (LendingException e) {
            if (e.getErrorCode() == LendingErrorCode.RATE_UNAVAILABLE) {
                lendingMetrics.recordRateUnavailable(operation);
            }
            throw e;
        }
    }

    private void appendOperation(Loan loan, OperationType type, long baseAmount, long cryptoAmount,
                                 Long executionRate, Map<String, Object> details, Instant now) {
        operationLog.append(LoanOperation.builder()
            .id(UUID.randomUUID())
            .loanId(loan.getId())
            .accountId(loan.getAccountId())
            .type(type)
            .baseAmount(baseAmount)
            .cryptoAmount(cryptoAmount)
            .executionRate(executionRate)
            .details(details)
            .createdAt(now)
            .build());
    }

    private <T> T instrumented(String operation, UUID accountId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());
        try {
            T result = body.get();

            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, "success");
            lendingMetrics.recordOperationLatency(operation, duration);
            log.debug("Lending operation completed: operation={}, duration={}ms", operation, duration);
            return result;

        } catch (LendingException e) {
            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, e.getErrorCode().name().toLowerCase());
            lendingMetrics.recordOperationLatency(operation, duration);
            log.warn("Lending operation rejected: operation={}, code={}, message={}, duration={}ms",
                operation, e.getErrorCode(), e.getMessage(), duration);
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, "error");
            lendingMetrics.recordOperationLatency(operation, duration);
            log.error("Lending operation failed: operation={}, error={}, duration={}ms",
                operation, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private static void requirePositive(long amount, String label) {
        if (amount <= 0) {
            throw new IllegalArgumentException(label + " must be positive: " + amount);
        }
    }
}
