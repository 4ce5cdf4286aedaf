package com.flagship.lending_ledger.liquidation;

import com.flagship.lending_ledger.account.AccountLedgerService;
import com.flagship.lending_ledger.interest.InterestPostingService;
import com.flagship.lending_ledger.loan.LockedLoan;
import com.flagship.lending_ledger.loan.Loan;
import com.flagship.lending_ledger.loan.LoanLocks;
import com.flagship.lending_ledger.loan.LoanMath;
import com.flagship.lending_ledger.loan.LoanPersistenceService;
import com.flagship.lending_ledger.loan.RepaymentQuote;
import com.flagship.lending_ledger.loan.RiskStatus;
import com.flagship.lending_ledger.loan.event.LoanLiquidatedEvent;
import com.flagship.lending_ledger.loan.event.LoanRiskWarningEvent;
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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Sells pledged collateral against loan debt.
 *
 * Three ways in:
 * - automatic: the risk monitor brings a loan at or above the liquidation threshold
 *   back down to the liquidation target ({@link #evaluateLoan})
 * - manual full liquidation by an operator or the owner: clears all debt, minimum
 *   interest included, and returns the rest of the collateral
 * - owner sale of a chosen amount of collateral, which closes the loan if the
 *   proceeds cover everything owed
 *
 * Sales execute at the sell rate. The amount to sell rounds up and the proceeds round
 * down, so a sale never leaves less value against the debt than the calculation assumed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationService {

    static final String TRIGGER_RISK_MONITOR = "risk_monitor";
    static final String TRIGGER_OPERATOR = "operator";
    static final String TRIGGER_OWNER = "owner";

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
     * Re-checks one loan under its lock at the given rate and acts on the result:
     * liquidates down to the target at or above the liquidation threshold, raises a
     * warning event in the warning band unless one is already outstanding.
     *
     * @param warningOutstanding whether a warning for this loan was already raised and the
     *                           loan has not left the band since
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public RiskEvaluation evaluateLoan(UUID loanId, MarketRates rates, LendingSettings settings,
                                       boolean warningOutstanding) {
        LockedLoan locked = loanLocks.lockLoan(loanId);
        Loan loan = locked.getLoan();
        if (!loan.isActive() || loan.getBorrowedAmount() <= 0 || loan.getCollateralAmount() <= 0) {
            log.debug("Skipping risk check for loan {}: status={}, borrowed={}, collateral={}",
                loanId, loan.getStatus(), loan.getBorrowedAmount(), loan.getCollateralAmount());
            return RiskEvaluation.skipped(loanId);
        }

        BigDecimal currentLtv = LoanMath.currentLtv(
            loan.getBorrowedAmount(), loan.getCollateralAmount(), rates.getSellRate());
        RiskStatus riskStatus = LoanMath.riskStatus(
            loan.getBorrowedAmount(), loan.getCollateralAmount(), rates.getSellRate(),
            settings.getWarningThreshold(), settings.getLiquidationThreshold());

        switch (riskStatus) {
            case LIQUIDATE -> {
                MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
                try {
                    log.warn("Loan breached liquidation threshold: ltv={}, threshold={}, sellRate={}",
                        currentLtv, settings.getLiquidationThreshold(), rates.getSellRate());
                    LiquidationResult result = liquidateToTarget(loan, rates, settings, currentLtv);
                    return new RiskEvaluation(loanId, RiskEvaluation.Outcome.LIQUIDATED,
                        riskStatus, currentLtv, false, result);
                } finally {
                    MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
                }
            }
            case WARNING -> {
                if (!warningOutstanding) {
                    outboxService.saveEvent(LoanRiskWarningEvent.from(loan, currentLtv,
                        settings.getWarningThreshold(), settings.getLiquidationThreshold(),
                        rates.getSellRate(), clock.instant()));
                    lendingMetrics.recordRiskWarning();
                    log.warn("Loan entered warning band: loanId={}, ltv={}, warningThreshold={}, liquidationPrice={}",
                        loanId, currentLtv, settings.getWarningThreshold(), loan.getLiquidationPrice());
                }
                return new RiskEvaluation(loanId, RiskEvaluation.Outcome.WARNING,
                    riskStatus, currentLtv, !warningOutstanding, null);
            }
            default -> {
                return new RiskEvaluation(loanId, RiskEvaluation.Outcome.SAFE,
                    riskStatus, currentLtv, false, null);
            }
        }
    }

    /**
     * Operator-initiated full liquidation of any active loan, regardless of its LTV.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public LiquidationResult forceLiquidate(UUID loanId) {
        return instrumented("force_liquidate", () -> {
            LendingSettings settings = settingsService.current();
            MarketRates rates = currentRates("force_liquidate");
            LockedLoan locked = loanLocks.lockLoan(loanId);
            if (!locked.getLoan().isActive()) {
                throw LendingException.of(LendingErrorCode.NO_ACTIVE_LOAN,
                    "Loan %s is %s and cannot be liquidated", loanId, locked.getLoan().getStatus());
            }
            return liquidateFully(locked.getLoan(), rates, settings, TRIGGER_OPERATOR);
        });
    }

    /**
     * Owner-initiated full liquidation of the account's active loan. With no debt this
     * simply closes the loan and hands back all collateral.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public LiquidationResult liquidate(UUID accountId) {
        return instrumented("liquidate", () -> {
            LendingSettings settings = settingsService.current();
            MarketRates rates = currentRates("liquidate");
            LockedLoan locked = loanLocks.lockActiveLoanOf(accountId);
            return liquidateFully(locked.getLoan(), rates, settings, TRIGGER_OWNER);
        });
    }

    /**
     * Sells the given amount of the account's collateral and applies the proceeds to the debt.
     *
     * If the proceeds cover the total amount due (minimum interest included), the loan is
     * closed, the surplus credited and the unsold collateral returned. Otherwise the debt
     * falls by the proceeds and the loan stays active; such a sale may neither use up all
     * collateral nor clear the balance without the minimum interest.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
        maxAttemptsExpression = "${lending.retry-max-attempts:3}",
        backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public LiquidationResult sellCollateral(UUID accountId, long cryptoAmount) {
        return instrumented("sell_collateral", () -> {
            if (cryptoAmount <= 0) {
                throw new IllegalArgumentException("Collateral amount must be positive: " + cryptoAmount);
            }
            LendingSettings settings = settingsService.current();
            MarketRates rates = currentRates("sell_collateral");
            long sellRate = rates.getSellRate();

            Loan loan = loanLocks.lockActiveLoanOf(accountId).getLoan();
            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());
            if (loan.getBorrowedAmount() <= 0) {
                throw new LendingException(LendingErrorCode.NO_OUTSTANDING_DEBT,
                    "Loan " + loan.getId() + " has no debt to sell collateral against");
            }
            if (cryptoAmount > loan.getCollateralAmount()) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_COLLATERAL,
                    "Requested %d exceeds the %d pledged", cryptoAmount, loan.getCollateralAmount());
            }

            Instant now = clock.instant();
            BigDecimal ltvBefore = LoanMath.currentLtv(
                loan.getBorrowedAmount(), loan.getCollateralAmount(), sellRate);
            long proceeds = LoanMath.saleProceeds(cryptoAmount, sellRate);
            if (proceeds <= 0) {
                throw new IllegalArgumentException(String.format(
                    "Selling %d crypto units at %d yields no proceeds", cryptoAmount, sellRate));
            }
            RepaymentQuote quote = loan.quoteRepayment(now, settings.getMinimumInterestDays());

            if (proceeds >= quote.getTotalAmountDue()) {
                Loan charged = interestPostingService.postMinimumInterest(
                    loan, quote, settings.getLiquidationThreshold(), now);
                return closeWithSale(charged, cryptoAmount, proceeds, quote.getInterestShortfall(),
                    rates, ltvBefore, TRIGGER_OWNER, now);
            }
            if (cryptoAmount == loan.getCollateralAmount()) {
                throw LendingException.of(LendingErrorCode.INSUFFICIENT_COLLATERAL_FOR_LIQUIDATION,
                    "Selling all collateral yields %d, short of the %d due", proceeds, quote.getTotalAmountDue());
            }
            if (proceeds >= loan.getBorrowedAmount()) {
                throw LendingException.of(LendingErrorCode.MINIMUM_INTEREST_NOT_MET,
                    "Proceeds of %d would clear the balance but not the %d due with minimum interest",
                    proceeds, quote.getTotalAmountDue());
            }
            return reduceWithSale(loan, cryptoAmount, proceeds, rates, settings, ltvBefore, TRIGGER_OWNER, now);
        });
    }

    /**
     * Loans with debt valued at the current sell rate, highest LTV first.
     *
     * @param includeSafe also list loans below the warning threshold
     */
    @Transactional(readOnly = true)
    public List<AtRiskLoan> listAtRiskLoans(boolean includeSafe) {
        LendingSettings settings = settingsService.current();
        MarketRates rates = currentRates("list_at_risk");
        long sellRate = rates.getSellRate();

        return loanPersistenceService.findActiveWithDebt().stream()
            .filter(loan -> loan.getCollateralAmount() > 0)
            .map(loan -> {
                BigDecimal ltv = LoanMath.currentLtv(loan.getBorrowedAmount(), loan.getCollateralAmount(), sellRate);
                return AtRiskLoan.builder()
                    .loanId(loan.getId())
                    .accountId(loan.getAccountId())
                    .collateralAmount(loan.getCollateralAmount())
                    .borrowedAmount(loan.getBorrowedAmount())
                    .liquidationPrice(loan.getLiquidationPrice())
                    .sellRate(sellRate)
                    .currentLtv(ltv)
                    .riskStatus(LoanMath.riskStatus(loan.getBorrowedAmount(), loan.getCollateralAmount(),
                        sellRate, settings.getWarningThreshold(), settings.getLiquidationThreshold()))
                    .build();
            })
            .filter(view -> includeSafe || view.getRiskStatus() != RiskStatus.SAFE)
            .sorted(Comparator.comparing(AtRiskLoan::getCurrentLtv).reversed())
            .toList();
    }

    /**
     * Sells just enough collateral to bring the loan back to the liquidation target.
     * If that takes all collateral, or clears all debt, the loan closes; debt the
     * collateral could not cover is written off.
     */
    private LiquidationResult liquidateToTarget(Loan loan, MarketRates rates, LendingSettings settings,
                                                BigDecimal ltvBefore) {
        long sellRate = rates.getSellRate();
        Instant now = clock.instant();

        BigDecimal debtToClear = LoanMath.debtToClearForTarget(loan.getBorrowedAmount(),
            loan.getCollateralAmount(), sellRate, settings.getLiquidationTarget());
        long collateralSold = Math.min(LoanMath.collateralToCover(debtToClear, sellRate), loan.getCollateralAmount());
        long proceeds = LoanMath.saleProceeds(collateralSold, sellRate);
        long debtCleared = Math.min(proceeds, loan.getBorrowedAmount());

        // dust that sells for nothing cannot reduce the debt; close the loan instead
        if (proceeds <= 0) {
            collateralSold = loan.getCollateralAmount();
            proceeds = LoanMath.saleProceeds(collateralSold, sellRate);
        }
        if (collateralSold == loan.getCollateralAmount() || debtCleared == loan.getBorrowedAmount()) {
            return closeWithSale(loan, collateralSold, proceeds, 0L, rates, ltvBefore, TRIGGER_RISK_MONITOR, now);
        }
        return reduceWithSale(loan, collateralSold, proceeds, rates, settings, ltvBefore, TRIGGER_RISK_MONITOR, now);
    }

    /**
     * Clears everything owed, minimum interest included, by selling the collateral that
     * covers it. Refused, with nothing changed, when the collateral is not enough.
     */
    private LiquidationResult liquidateFully(Loan loan, MarketRates rates, LendingSettings settings, String trigger) {
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loan.getId().toString());
        long sellRate = rates.getSellRate();
        Instant now = clock.instant();

        RepaymentQuote quote = loan.quoteRepayment(now, settings.getMinimumInterestDays());
        long collateralSold = LoanMath.collateralToCover(quote.getTotalAmountDue(), sellRate);
        if (collateralSold > loan.getCollateralAmount()) {
            throw LendingException.of(LendingErrorCode.INSUFFICIENT_COLLATERAL_FOR_LIQUIDATION,
                "Covering %d due needs %d collateral, only %d pledged",
                quote.getTotalAmountDue(), collateralSold, loan.getCollateralAmount());
        }

        BigDecimal ltvBefore = loan.getBorrowedAmount() > 0
            ? LoanMath.currentLtv(loan.getBorrowedAmount(), loan.getCollateralAmount(), sellRate)
            : BigDecimal.ZERO;
        Loan charged = interestPostingService.postMinimumInterest(
            loan, quote, settings.getLiquidationThreshold(), now);
        long proceeds = LoanMath.saleProceeds(collateralSold, sellRate);
        return closeWithSale(charged, collateralSold, proceeds, quote.getInterestShortfall(),
            rates, ltvBefore, trigger, now);
    }

    /**
     * Closes the loan as LIQUIDATED after a sale: proceeds clear the debt, any surplus is
     * credited, unsold collateral goes back to the owner and uncovered debt is written off.
     */
    private LiquidationResult closeWithSale(Loan loan, long collateralSold, long proceeds,
                                            long minimumInterestApplied, MarketRates rates,
                                            BigDecimal ltvBefore, String trigger, Instant now) {
        UUID accountId = loan.getAccountId();
        long debtCleared = Math.min(proceeds, loan.getBorrowedAmount());
        long excessProceeds = proceeds - debtCleared;
        long badDebt = loan.getBorrowedAmount() - debtCleared;
        long collateralReturned = loan.getCollateralAmount() - collateralSold;

        Loan closed = loanPersistenceService.update(loan.liquidate(now));
        accountLedgerService.settleCollateralSale(accountId, collateralSold, debtCleared, excessProceeds);
        accountLedgerService.releaseCollateral(accountId, collateralReturned);
        accountLedgerService.clearLoanPosition(accountId);

        if (badDebt > 0) {
            log.error("Liquidation left uncovered debt, written off: loanId={}, badDebt={}, sellRate={}",
                loan.getId(), badDebt, rates.getSellRate());
        }

        LiquidationResult result = LiquidationResult.builder()
            .loanId(closed.getId())
            .accountId(accountId)
            .liquidationType(OperationType.FULL_LIQUIDATION)
            .trigger(trigger)
            .collateralSold(collateralSold)
            .proceeds(proceeds)
            .debtCleared(debtCleared)
            .excessProceeds(excessProceeds)
            .collateralReturned(collateralReturned)
            .badDebtWrittenOff(badDebt)
            .minimumInterestApplied(minimumInterestApplied)
            .executionRate(rates.getSellRate())
            .ltvBefore(ltvBefore)
            .ltvAfter(BigDecimal.ZERO)
            .remainingDebt(0L)
            .remainingCollateral(0L)
            .loanStatus(closed.getStatus())
            .build();
        record(closed, result, now);
        return result;
    }

    /**
     * Applies a sale that leaves the loan active with less debt and less collateral.
     */
    private LiquidationResult reduceWithSale(Loan loan, long collateralSold, long proceeds, MarketRates rates,
                                             LendingSettings settings, BigDecimal ltvBefore,
                                             String trigger, Instant now) {
        UUID accountId = loan.getAccountId();
        long debtCleared = Math.min(proceeds, loan.getBorrowedAmount());
        long excessProceeds = proceeds - debtCleared;

        Loan updated = loanPersistenceService.update(
            loan.applyCollateralSale(collateralSold, debtCleared, settings.getLiquidationThreshold(), now));
        accountLedgerService.settleCollateralSale(accountId, collateralSold, debtCleared, excessProceeds);

        LiquidationResult result = LiquidationResult.builder()
            .loanId(updated.getId())
            .accountId(accountId)
            .liquidationType(OperationType.PARTIAL_LIQUIDATION)
            .trigger(trigger)
            .collateralSold(collateralSold)
            .proceeds(proceeds)
            .debtCleared(debtCleared)
            .excessProceeds(excessProceeds)
            .collateralReturned(0L)
            .badDebtWrittenOff(0L)
            .minimumInterestApplied(0L)
            .executionRate(rates.getSellRate())
            .ltvBefore(ltvBefore)
            .ltvAfter(LoanMath.currentLtv(updated.getBorrowedAmount(), updated.getCollateralAmount(),
                rates.getSellRate()))
            .remainingDebt(updated.getBorrowedAmount())
            .remainingCollateral(updated.getCollateralAmount())
            .loanStatus(updated.getStatus())
            .build();
        record(updated, result, now);
        return result;
    }

    private void record(Loan loanAfter, LiquidationResult result, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("trigger", result.getTrigger());
        details.put("debt_cleared", result.getDebtCleared());
        details.put("collateral_sold", result.getCollateralSold());
        details.put("collateral_returned", result.getCollateralReturned());
        details.put("proceeds", result.getProceeds());
        details.put("excess_proceeds", result.getExcessProceeds());
        details.put("bad_debt_written_off", result.getBadDebtWrittenOff());
        details.put("minimum_interest_applied", result.getMinimumInterestApplied());
        details.put("execution_rate", result.getExecutionRate());
        details.put("ltv_before", result.getLtvBefore());
        details.put("ltv_after", result.getLtvAfter());

        operationLog.append(LoanOperation.builder()
            .id(UUID.randomUUID())
            .loanId(result.getLoanId())
            .accountId(result.getAccountId())
            .type(result.getLiquidationType())
            .baseAmount(result.getDebtCleared())
            .cryptoAmount(result.getCollateralSold())
            .executionRate(result.getExecutionRate())
            .details(details)
            .createdAt(now)
            .build());

        outboxService.saveEvent(LoanLiquidatedEvent.from(loanAfter, result.getLiquidationType(),
            result.getTrigger(), result.getDebtCleared(), result.getCollateralSold(),
            result.getCollateralReturned(), result.getExecutionRate(), result.getLtvBefore(), now));

        lendingMetrics.recordLiquidation(result.getLiquidationType().name(), result.getTrigger(),
            result.getCollateralSold());

        log.info("Liquidation executed: loanId={}, type={}, trigger={}, collateralSold={}, debtCleared={}, " +
                "collateralReturned={}, ltvBefore={}, ltvAfter={}",
            result.getLoanId(), result.getLiquidationType(), result.getTrigger(), result.getCollateralSold(),
            result.getDebtCleared(), result.getCollateralReturned(), result.getLtvBefore(), result.getLtvAfter());
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

    private <T> T instrumented(String operation, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        try {
            T result = body.get();

            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, "success");
            lendingMetrics.recordOperationLatency(operation, duration);
            return result;

        } catch (LendingException e) {
            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, e.getErrorCode().name().toLowerCase());
            lendingMetrics.recordOperationLatency(operation, duration);
            log.warn("Liquidation rejected: operation={}, code={}, message={}, duration={}ms",
                operation, e.getErrorCode(), e.getMessage(), duration);
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordOperation(operation, "error");
            lendingMetrics.recordOperationLatency(operation, duration);
            log.error("Liquidation failed: operation={}, error={}, duration={}ms",
                operation, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }
}
