package com.flagship.lending_ledger.loan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loan state machine and the minimum-interest floor.
 */
class LoanTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("90");
    private static final Instant OPENED_AT = Instant.parse("2024-03-01T00:00:00Z");

    private Loan loan;

    @BeforeEach
    void setUp() {
        loan = Loan.open(UUID.randomUUID(), 300_000L, new BigDecimal("60"), new BigDecimal("15"), OPENED_AT)
            .borrow(10_000L, THRESHOLD, OPENED_AT);
    }

    @Test
    @DisplayName("Opening a loan holds collateral and no debt")
    void openLoan() {
        Loan opened = Loan.open(UUID.randomUUID(), 300_000L, new BigDecimal("60"), new BigDecimal("15"), OPENED_AT);

        assertEquals(LoanStatus.ACTIVE, opened.getStatus());
        assertEquals(300_000L, opened.getCollateralAmount());
        assertEquals(0L, opened.getBorrowedAmount());
        assertEquals(0L, opened.getLiquidationPrice());
        assertNull(opened.getLastAccruedOn());
    }

    @Test
    @DisplayName("Opening without collateral is rejected")
    void openWithoutCollateral() {
        assertThrows(IllegalArgumentException.class,
            () -> Loan.open(UUID.randomUUID(), 0L, new BigDecimal("60"), new BigDecimal("15"), OPENED_AT));
    }

    @Test
    @DisplayName("Borrowing grows balance and principal and moves the liquidation price")
    void borrow() {
        assertEquals(10_000L, loan.getBorrowedAmount());
        assertEquals(10_000L, loan.getPrincipal());
        assertEquals(3_703_703L, loan.getLiquidationPrice());
    }

    @Test
    @DisplayName("Daily interest moves the accrual guard, a top-up does not")
    void chargeInterest() {
        LocalDate day = LocalDate.of(2024, 3, 2);
        Loan accrued = loan.chargeInterest(4L, day, THRESHOLD, OPENED_AT);
        assertEquals(10_004L, accrued.getBorrowedAmount());
        assertEquals(4L, accrued.getInterestAccrued());
        assertEquals(10_000L, accrued.getPrincipal());
        assertEquals(day, accrued.getLastAccruedOn());

        Loan toppedUp = accrued.chargeInterest(119L, null, THRESHOLD, OPENED_AT);
        assertEquals(123L, toppedUp.getInterestAccrued());
        assertEquals(day, toppedUp.getLastAccruedOn());
    }

    @Test
    @DisplayName("Quote charges the minimum interest days on early close")
    void quoteEarlyClose() {
        RepaymentQuote quote = loan.quoteRepayment(OPENED_AT.plus(Duration.ofDays(1)), 30);

        assertEquals(1L, quote.getDaysElapsed());
        assertEquals(30L, quote.getDaysCharged());
        assertEquals(123L, quote.getMinimumInterestDue());
        assertEquals(123L, quote.getInterestShortfall());
        assertEquals(10_123L, quote.getTotalAmountDue());
        assertTrue(quote.requiresTopUp());
    }

    @Test
    @DisplayName("Quote credits interest already charged against the floor")
    void quoteAfterAccrual() {
        Loan accrued = loan.chargeInterest(4L, LocalDate.of(2024, 3, 2), THRESHOLD, OPENED_AT);
        RepaymentQuote quote = accrued.quoteRepayment(OPENED_AT.plus(Duration.ofDays(1)), 30);

        assertEquals(119L, quote.getInterestShortfall());
        assertEquals(10_123L, quote.getTotalAmountDue());
    }

    @Test
    @DisplayName("Past the minimum period the floor follows elapsed days")
    void quotePastMinimum() {
        RepaymentQuote quote = loan.quoteRepayment(OPENED_AT.plus(Duration.ofDays(40)), 30);

        assertEquals(40L, quote.getDaysCharged());
        assertEquals(164L, quote.getMinimumInterestDue());
    }

    @Test
    @DisplayName("Full repayment closes the loan as REPAID")
    void fullRepayment() {
        Instant now = OPENED_AT.plus(Duration.ofDays(2));
        Loan repaid = loan.repay(10_000L, THRESHOLD, now);

        assertEquals(LoanStatus.REPAID, repaid.getStatus());
        assertEquals(0L, repaid.getBorrowedAmount());
        assertEquals(0L, repaid.getCollateralAmount());
        assertEquals(now, repaid.getClosedAt());
        assertTrue(repaid.isTerminal());
    }

    @Test
    @DisplayName("Partial repayment keeps the loan active")
    void partialRepayment() {
        Loan repaid = loan.repay(4_000L, THRESHOLD, OPENED_AT);

        assertEquals(LoanStatus.ACTIVE, repaid.getStatus());
        assertEquals(6_000L, repaid.getBorrowedAmount());
        assertEquals(300_000L, repaid.getCollateralAmount());
    }

    @Test
    @DisplayName("Repaying more than the balance is rejected")
    void overRepayment() {
        assertThrows(IllegalStateException.class, () -> loan.repay(10_001L, THRESHOLD, OPENED_AT));
    }

    @Test
    @DisplayName("Closed loans reject every change")
    void terminalLoanIsFrozen() {
        Loan repaid = loan.repay(10_000L, THRESHOLD, OPENED_AT);

        assertThrows(IllegalStateException.class, () -> repaid.borrow(1L, THRESHOLD, OPENED_AT));
        assertThrows(IllegalStateException.class, () -> repaid.addCollateral(1L, THRESHOLD, OPENED_AT));
        assertThrows(IllegalStateException.class, () -> repaid.liquidate(OPENED_AT));
        assertFalse(repaid.canTransitionTo(LoanStatus.LIQUIDATED));
        assertFalse(repaid.canTransitionTo(LoanStatus.ACTIVE));
    }

    @Test
    @DisplayName("Partial collateral sale must leave both collateral and debt")
    void partialSaleBounds() {
        Loan sold = loan.applyCollateralSale(50_000L, 4_500L, THRESHOLD, OPENED_AT);
        assertEquals(250_000L, sold.getCollateralAmount());
        assertEquals(5_500L, sold.getBorrowedAmount());

        assertThrows(IllegalStateException.class,
            () -> loan.applyCollateralSale(300_000L, 4_500L, THRESHOLD, OPENED_AT));
        assertThrows(IllegalStateException.class,
            () -> loan.applyCollateralSale(50_000L, 10_000L, THRESHOLD, OPENED_AT));
        assertThrows(IllegalStateException.class,
            () -> loan.applyCollateralSale(1L, 0L, THRESHOLD, OPENED_AT));
    }

    @Test
    @DisplayName("Liquidation closes the loan as LIQUIDATED")
    void liquidate() {
        Loan liquidated = loan.liquidate(OPENED_AT);

        assertEquals(LoanStatus.LIQUIDATED, liquidated.getStatus());
        assertEquals(0L, liquidated.getCollateralAmount());
        assertEquals(0L, liquidated.getBorrowedAmount());
    }
}
