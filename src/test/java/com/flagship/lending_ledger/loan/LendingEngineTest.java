package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.IntegrationTestSupport;
import com.flagship.lending_ledger.account.AccountBalances;
import com.flagship.lending_ledger.loan.dto.AddCollateralResponse;
import com.flagship.lending_ledger.loan.dto.BorrowResponse;
import com.flagship.lending_ledger.loan.dto.DepositCollateralResponse;
import com.flagship.lending_ledger.loan.dto.LoanOperationResponse;
import com.flagship.lending_ledger.loan.dto.LoanStatusResponse;
import com.flagship.lending_ledger.loan.dto.RepayResponse;
import com.flagship.lending_ledger.loan.event.LoanRepaidEvent;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.loan.operation.OperationType;
import com.flagship.lending_ledger.outbox.OutboxEvent;
import com.flagship.lending_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Loan lifecycle against a real database: deposit, borrow, repay with the minimum-interest
 * floor, add collateral, status, history and the one-active-loan rule under concurrency.
 *
 * Reference scenario: 0.003 units of collateral at a sell rate of 9,000,000 and the
 * default 60% LTV give a borrowing capacity of 16,200.
 */
class LendingEngineTest extends IntegrationTestSupport {

    private static final long SELL_RATE = 9_000_000L;
    private static final long COLLATERAL = 300_000L;

    @Autowired
    private LendingEngine lendingEngine;

    @Autowired
    private LoanPersistenceService loanPersistenceService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        givenSellRate(SELL_RATE);
    }

    private LendingErrorCode errorCodeOf(Runnable operation) {
        LendingException ex = assertThrows(LendingException.class, operation::run);
        printExpectedException("LendingException", ex.getMessage());
        return ex.getErrorCode();
    }

    private UUID openLoanWithDebt(UUID accountId, long borrow) {
        DepositCollateralResponse deposit = lendingEngine.depositCollateral(accountId, COLLATERAL, null);
        lendingEngine.borrow(accountId, borrow);
        return deposit.getLoanId();
    }

    @Test
    @DisplayName("Depositing collateral opens a loan and pledges the crypto")
    void depositCollateral() {
        printTestHeader("Deposit collateral");
        UUID accountId = openAccount(500_000L, 0L);
        printInput("Collateral", COLLATERAL);
        printInput("Sell rate", SELL_RATE);

        DepositCollateralResponse response = lendingEngine.depositCollateral(accountId, COLLATERAL, null);
        printOutput("Response", response);

        assertNotNull(response.getLoanId());
        assertEquals(COLLATERAL, response.getCollateralAmount());
        assertEquals(16_200L, response.getMaxBorrowable());
        assertEquals(0L, response.getLiquidationPrice());
        assertEquals(0, new BigDecimal("60").compareTo(response.getLtvRatio()));
        assertEquals(0, new BigDecimal("15").compareTo(response.getInterestRate()));

        AccountBalances balances = balances(accountId);
        assertEquals(200_000L, balances.getAvailableCrypto());
        assertEquals(COLLATERAL, balances.getCollateralCrypto());
        printSuccess("Loan opened with " + response.getMaxBorrowable() + " capacity");
    }

    @Test
    @DisplayName("Requested LTV sets the loan's capacity")
    void depositWithRequestedLtv() {
        UUID accountId = openAccount(COLLATERAL, 0L);

        DepositCollateralResponse response =
            lendingEngine.depositCollateral(accountId, COLLATERAL, new BigDecimal("50"));

        assertEquals(13_500L, response.getMaxBorrowable());
    }

    @Test
    @DisplayName("LTV at or above the liquidation threshold is rejected")
    void depositWithLtvAboveThreshold() {
        UUID accountId = openAccount(COLLATERAL, 0L);

        assertThrows(IllegalArgumentException.class,
            () -> lendingEngine.depositCollateral(accountId, COLLATERAL, new BigDecimal("90")));
        assertEquals(COLLATERAL, balances(accountId).getAvailableCrypto());
    }

    @Test
    @DisplayName("Second deposit while a loan is active fails with LOAN_ALREADY_ACTIVE")
    void secondDepositRejected() {
        UUID accountId = openAccount(2 * COLLATERAL, 0L);
        lendingEngine.depositCollateral(accountId, COLLATERAL, null);

        assertEquals(LendingErrorCode.LOAN_ALREADY_ACTIVE,
            errorCodeOf(() -> lendingEngine.depositCollateral(accountId, COLLATERAL, null)));
        assertEquals(COLLATERAL, balances(accountId).getAvailableCrypto());
    }

    @Test
    @DisplayName("Depositing more crypto than available fails with INSUFFICIENT_FUNDS")
    void depositWithoutFunds() {
        UUID accountId = openAccount(100_000L, 0L);

        assertEquals(LendingErrorCode.INSUFFICIENT_FUNDS,
            errorCodeOf(() -> lendingEngine.depositCollateral(accountId, COLLATERAL, null)));
        assertTrue(loanPersistenceService.findActiveLoan(accountId).isEmpty());
    }

    @Test
    @DisplayName("Borrowing disburses funds and reports the remaining capacity")
    void borrow() {
        printTestHeader("Borrow against collateral");
        UUID accountId = openAccount(COLLATERAL, 0L);
        lendingEngine.depositCollateral(accountId, COLLATERAL, null);
        printInput("Borrow", 10_000L);

        BorrowResponse response = lendingEngine.borrow(accountId, 10_000L);
        printOutput("Response", response);

        assertEquals(10_000L, response.getNewBorrowedTotal());
        assertEquals(6_200L, response.getAvailableCapacity());
        assertEquals(3_703_703L, response.getLiquidationPrice());

        AccountBalances balances = balances(accountId);
        assertEquals(10_000L, balances.getAvailableBase());
        assertEquals(10_000L, balances.getBorrowedBase());
        printSuccess("Borrowed within capacity");
    }

    @Test
    @DisplayName("Borrowing past capacity fails with INSUFFICIENT_CAPACITY")
    void borrowPastCapacity() {
        UUID accountId = openAccount(COLLATERAL, 0L);
        openLoanWithDebt(accountId, 10_000L);

        assertEquals(LendingErrorCode.INSUFFICIENT_CAPACITY,
            errorCodeOf(() -> lendingEngine.borrow(accountId, 6_201L)));

        BorrowResponse response = lendingEngine.borrow(accountId, 6_200L);
        assertEquals(16_200L, response.getNewBorrowedTotal());
        assertEquals(0L, response.getAvailableCapacity());
    }

    @Test
    @DisplayName("Borrowing without a loan fails with NO_ACTIVE_LOAN")
    void borrowWithoutLoan() {
        UUID accountId = openAccount(COLLATERAL, 0L);

        assertEquals(LendingErrorCode.NO_ACTIVE_LOAN, errorCodeOf(() -> lendingEngine.borrow(accountId, 100L)));
    }

    @Test
    @DisplayName("Early full repayment charges the minimum interest and returns all collateral")
    void earlyFullRepayment() {
        printTestHeader("Early full repayment with minimum interest");
        UUID accountId = openAccount(COLLATERAL, 1_000L);
        UUID loanId = openLoanWithDebt(accountId, 10_000L);
        jdbcTemplate.update("UPDATE loans SET created_at = created_at - INTERVAL '1 day' WHERE id = ?", loanId);
        AccountBalances before = balances(accountId);
        printInput("Repay", 10_123L);

        RepayResponse response = lendingEngine.repay(accountId, 10_123L);
        printOutput("Response", response);

        assertEquals(LoanStatus.REPAID, response.getLoanStatus());
        assertEquals(0L, response.getRemainingDebt());
        assertEquals(123L, response.getMinimumInterestApplied());
        assertEquals(COLLATERAL, response.getCollateralReturned());

        AccountBalances after = balances(accountId);
        assertEquals(COLLATERAL, after.getAvailableCrypto());
        assertEquals(0L, after.getCollateralCrypto());
        assertEquals(877L, after.getAvailableBase());
        assertEquals(0L, after.getBorrowedBase());
        assertEquals(0L, after.getInterestAccruedBase());

        // Cash paid beyond the debt reduction is exactly the interest
        long availableChange = after.getAvailableBase() - before.getAvailableBase();
        long borrowedChange = after.getBorrowedBase() - before.getBorrowedBase();
        assertEquals(-123L, availableChange - borrowedChange);

        Loan closed = loanPersistenceService.findById(loanId).orElseThrow();
        assertEquals(LoanStatus.REPAID, closed.getStatus());
        assertEquals(123L, closed.getInterestAccrued());
        assertNotNull(closed.getClosedAt());

        List<OutboxEvent> events = outboxService.getEventsForLoan(loanId);
        assertEquals(1, events.size());
        assertEquals(LoanRepaidEvent.EVENT_TYPE, events.get(0).getEventType());
        printSuccess("Loan repaid, " + response.getCollateralReturned() + " collateral returned");
    }

    @Test
    @DisplayName("Repaying only the balance without the minimum interest fails with MINIMUM_INTEREST_NOT_MET")
    void repayWithoutMinimumInterest() {
        UUID accountId = openAccount(COLLATERAL, 1_000L);
        openLoanWithDebt(accountId, 10_000L);

        assertEquals(LendingErrorCode.MINIMUM_INTEREST_NOT_MET,
            errorCodeOf(() -> lendingEngine.repay(accountId, 10_000L)));
        assertEquals(10_000L, balances(accountId).getBorrowedBase());
    }

    @Test
    @DisplayName("Repaying more than the total due fails with EXCEEDS_OUTSTANDING_DEBT")
    void overRepayment() {
        UUID accountId = openAccount(COLLATERAL, 1_000L);
        openLoanWithDebt(accountId, 10_000L);

        assertEquals(LendingErrorCode.EXCEEDS_OUTSTANDING_DEBT,
            errorCodeOf(() -> lendingEngine.repay(accountId, 10_124L)));
    }

    @Test
    @DisplayName("Repaying more than the available cash fails with INSUFFICIENT_FUNDS")
    void repayWithoutCash() {
        UUID accountId = openAccount(COLLATERAL, 0L);
        openLoanWithDebt(accountId, 10_000L);

        assertEquals(LendingErrorCode.INSUFFICIENT_FUNDS,
            errorCodeOf(() -> lendingEngine.repay(accountId, 10_123L)));
    }

    @Test
    @DisplayName("Partial repayment reduces the debt and keeps the collateral pledged")
    void partialRepayment() {
        UUID accountId = openAccount(COLLATERAL, 0L);
        openLoanWithDebt(accountId, 10_000L);

        RepayResponse response = lendingEngine.repay(accountId, 4_000L);

        assertEquals(LoanStatus.ACTIVE, response.getLoanStatus());
        assertEquals(6_000L, response.getRemainingDebt());
        assertEquals(0L, response.getMinimumInterestApplied());
        assertEquals(0L, response.getCollateralReturned());

        AccountBalances balances = balances(accountId);
        assertEquals(6_000L, balances.getAvailableBase());
        assertEquals(6_000L, balances.getBorrowedBase());
        assertEquals(COLLATERAL, balances.getCollateralCrypto());
    }

    @Test
    @DisplayName("Repaying a loan without debt fails with NO_OUTSTANDING_DEBT")
    void repayWithoutDebt() {
        UUID accountId = openAccount(COLLATERAL, 1_000L);
        lendingEngine.depositCollateral(accountId, COLLATERAL, null);

        assertEquals(LendingErrorCode.NO_OUTSTANDING_DEBT, errorCodeOf(() -> lendingEngine.repay(accountId, 100L)));
    }

    @Test
    @DisplayName("Adding collateral lowers LTV and raises capacity")
    void addCollateral() {
        UUID accountId = openAccount(400_000L, 0L);
        openLoanWithDebt(accountId, 10_000L);

        AddCollateralResponse response = lendingEngine.addCollateral(accountId, 100_000L);

        assertEquals(400_000L, response.getNewTotalCollateral());
        assertEquals(new BigDecimal("27.7778"), response.getNewLtv());
        assertEquals(21_600L, response.getNewMaxBorrowable());
        assertEquals(11_600L, response.getNewAvailableCapacity());
        assertEquals(2_777_777L, response.getNewLiquidationPrice());
        assertEquals(400_000L, balances(accountId).getCollateralCrypto());
    }

    @Test
    @DisplayName("Status values the loan without changing it")
    void statusIsReadOnly() {
        UUID accountId = openAccount(COLLATERAL, 0L);
        UUID loanId = openLoanWithDebt(accountId, 10_000L);
        Loan before = loanPersistenceService.findById(loanId).orElseThrow();

        LoanStatusResponse status = lendingEngine.getStatus(accountId);
        printOutput("Status", status);

        assertEquals(loanId, status.getLoanId());
        assertEquals(new BigDecimal("37.0370"), status.getCurrentLtv());
        assertEquals(16_200L, status.getMaxBorrowable());
        assertEquals(6_200L, status.getAvailableCapacity());
        assertEquals(RiskStatus.SAFE, status.getRiskStatus());
        assertEquals(123L, status.getMinimumInterestDue());
        assertEquals(10_123L, status.getTotalAmountDue());

        Loan after = loanPersistenceService.findById(loanId).orElseThrow();
        assertEquals(before.getBorrowedAmount(), after.getBorrowedAmount());
        assertEquals(before.getInterestAccrued(), after.getInterestAccrued());
        assertEquals(before.getUpdatedAt(), after.getUpdatedAt());
    }

    @Test
    @DisplayName("Without a fresh rate, valuation fails with RATE_UNAVAILABLE and nothing changes")
    void rateUnavailable() {
        UUID accountId = openAccount(COLLATERAL, 0L);
        openLoanWithDebt(accountId, 10_000L);
        when(rateOracle.currentRates())
            .thenThrow(new LendingException(LendingErrorCode.RATE_UNAVAILABLE, "stale"));

        assertEquals(LendingErrorCode.RATE_UNAVAILABLE, errorCodeOf(() -> lendingEngine.borrow(accountId, 100L)));
        assertEquals(LendingErrorCode.RATE_UNAVAILABLE, errorCodeOf(() -> lendingEngine.getStatus(accountId)));
        assertEquals(10_000L, balances(accountId).getBorrowedBase());
    }

    @Test
    @DisplayName("History lists the loan's operations newest first")
    void history() {
        UUID accountId = openAccount(COLLATERAL, 1_000L);
        UUID loanId = openLoanWithDebt(accountId, 10_000L);
        lendingEngine.repay(accountId, 10_123L);

        List<LoanOperationResponse> history = lendingEngine.getHistory(accountId, loanId);
        printOutput("History", history);

        List<OperationType> types = history.stream().map(LoanOperationResponse::getOperationType).toList();
        assertEquals(List.of(OperationType.REPAY, OperationType.INTEREST_ACCRUAL,
            OperationType.BORROW, OperationType.COLLATERAL_DEPOSIT), types);
        assertEquals(10_123L, history.get(0).getBaseAmount());
        assertEquals(COLLATERAL, history.get(0).getCryptoAmount());
        assertEquals(123L, history.get(1).getBaseAmount());
    }

    @Test
    @DisplayName("Concurrent full repayments: exactly one succeeds")
    void concurrentRepayments() throws InterruptedException {
        printTestHeader("Concurrent repayments");
        UUID accountId = openAccount(COLLATERAL, 20_000L);
        openLoanWithDebt(accountId, 10_000L);

        List<LendingErrorCode> failures = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger successes = new AtomicInteger();
        runConcurrently(2, () -> {
            try {
                lendingEngine.repay(accountId, 10_123L);
                successes.incrementAndGet();
            } catch (LendingException e) {
                failures.add(e.getErrorCode());
            }
        });
        printOutput("Successes", successes.get());
        printOutput("Failures", failures);

        assertEquals(1, successes.get());
        assertEquals(List.of(LendingErrorCode.NO_ACTIVE_LOAN), failures);
        assertEquals(30_000L - 10_123L, balances(accountId).getAvailableBase());
        printSuccess("Only one repayment applied");
    }

    @Test
    @DisplayName("Concurrent deposits: exactly one loan is opened")
    void concurrentDeposits() throws InterruptedException {
        UUID accountId = openAccount(2 * COLLATERAL, 0L);

        List<LendingErrorCode> failures = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger successes = new AtomicInteger();
        runConcurrently(2, () -> {
            try {
                lendingEngine.depositCollateral(accountId, COLLATERAL, null);
                successes.incrementAndGet();
            } catch (LendingException e) {
                failures.add(e.getErrorCode());
            }
        });

        assertEquals(1, successes.get());
        assertEquals(List.of(LendingErrorCode.LOAN_ALREADY_ACTIVE), failures);
        assertEquals(COLLATERAL, balances(accountId).getCollateralCrypto());
    }

    private static void runConcurrently(int threads, Runnable task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    task.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();
    }
}
