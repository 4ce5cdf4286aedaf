package com.flagship.lending_ledger.loan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fixed-point valuation: capacity, LTV, liquidation price, interest and sale sizing.
 *
 * Amounts use a BTC-like asset (1 unit = 100,000,000) against a base currency in minor units.
 */
class LoanMathTest {

    private static final BigDecimal SIXTY = new BigDecimal("60");
    private static final BigDecimal NINETY = new BigDecimal("90");
    private static final BigDecimal EIGHTY_FIVE = new BigDecimal("85");
    private static final BigDecimal FIFTEEN = new BigDecimal("15");

    @Test
    @DisplayName("Max borrowable is collateral value times LTV, rounded down")
    void maxBorrowableRoundsDown() {
        // 0.003 units at 9,000,000 is worth 27,000; 60% of that is 16,200
        assertEquals(16_200L, LoanMath.maxBorrowable(300_000L, 9_000_000L, SIXTY));
        // 0.00000001 units is worth 0.09, which floors to nothing
        assertEquals(0L, LoanMath.maxBorrowable(1L, 9_000_000L, SIXTY));
    }

    @Test
    @DisplayName("Liquidation price is the sell rate at which LTV reaches the threshold")
    void liquidationPrice() {
        assertEquals(3_703_703L, LoanMath.liquidationPrice(10_000L, 300_000L, NINETY));
        assertEquals(0L, LoanMath.liquidationPrice(0L, 300_000L, NINETY));
        assertEquals(0L, LoanMath.liquidationPrice(10_000L, 0L, NINETY));
    }

    @Test
    @DisplayName("Current LTV is a percentage with four decimals")
    void currentLtv() {
        assertEquals(new BigDecimal("37.0370"), LoanMath.currentLtv(10_000L, 300_000L, 9_000_000L));
        assertEquals(new BigDecimal("60.0000"), LoanMath.currentLtv(16_200L, 300_000L, 9_000_000L));
        assertEquals(0, BigDecimal.ZERO.compareTo(LoanMath.currentLtv(0L, 300_000L, 9_000_000L)));
    }

    @Test
    @DisplayName("Current LTV of debt without collateral cannot be computed")
    void currentLtvWithoutCollateral() {
        assertThrows(IllegalArgumentException.class, () -> LoanMath.currentLtv(100L, 0L, 9_000_000L));
    }

    @Test
    @DisplayName("Risk status thresholds are inclusive")
    void riskStatusBands() {
        // one whole unit at 10,000,000 is worth 10,000,000
        assertEquals(RiskStatus.SAFE, LoanMath.riskStatus(8_400_000L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
        assertEquals(RiskStatus.WARNING, LoanMath.riskStatus(8_500_000L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
        assertEquals(RiskStatus.WARNING, LoanMath.riskStatus(8_710_000L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
        assertEquals(RiskStatus.LIQUIDATE, LoanMath.riskStatus(9_000_000L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
        assertEquals(RiskStatus.SAFE, LoanMath.riskStatus(0L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
    }

    @Test
    @DisplayName("Risk status uses the exact ratio, not the rounded LTV")
    void riskStatusJustBelowThresholds() {
        // 89.99996% displays as 90.0000 but has not reached the liquidation threshold
        assertEquals(new BigDecimal("90.0000"), LoanMath.currentLtv(8_999_996L, 100_000_000L, 10_000_000L));
        assertEquals(RiskStatus.WARNING,
            LoanMath.riskStatus(8_999_996L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));

        // 84.99996% displays as 85.0000 but is still below the warning band
        assertEquals(new BigDecimal("85.0000"), LoanMath.currentLtv(8_499_996L, 100_000_000L, 10_000_000L));
        assertEquals(RiskStatus.SAFE,
            LoanMath.riskStatus(8_499_996L, 100_000_000L, 10_000_000L, EIGHTY_FIVE, NINETY));
    }

    @Test
    @DisplayName("Interest is simple interest on a 365-day year, rounded half-up")
    void interest() {
        // 10,000 at 15% for 30 days = 123.29
        assertEquals(123L, LoanMath.interestFor(10_000L, FIFTEEN, 30L));
        // 10,000 at 15% for one day = 4.11
        assertEquals(4L, LoanMath.dailyInterest(10_000L, FIFTEEN));
        assertEquals(0L, LoanMath.interestFor(10_000L, FIFTEEN, 0L));
    }

    @Test
    @DisplayName("Days elapsed counts whole days and never goes negative")
    void daysElapsed() {
        Instant now = Instant.parse("2024-03-10T12:00:00Z");
        assertEquals(1L, LoanMath.daysElapsed(now.minus(Duration.ofHours(36)), now));
        assertEquals(0L, LoanMath.daysElapsed(now.minus(Duration.ofHours(23)), now));
        assertEquals(0L, LoanMath.daysElapsed(now.plus(Duration.ofHours(5)), now));
    }

    @Test
    @DisplayName("Collateral to cover rounds up and its proceeds cover the amount")
    void collateralToCoverRoundsUp() {
        long crypto = LoanMath.collateralToCover(10_000L, 9_000_000L);
        assertEquals(111_112L, crypto);
        assertTrue(LoanMath.saleProceeds(crypto, 9_000_000L) >= 10_000L);
        assertEquals(0L, LoanMath.collateralToCover(BigDecimal.ZERO, 9_000_000L));
    }

    @Test
    @DisplayName("Sale proceeds round down")
    void saleProceedsRoundDown() {
        assertEquals(10_000L, LoanMath.saleProceeds(111_112L, 9_000_000L));
        assertEquals(9_999L, LoanMath.saleProceeds(111_110L, 9_000_000L));
    }

    @Test
    @DisplayName("Debt to clear brings the post-sale LTV back to target")
    void debtToClearForTarget() {
        // 16,200 owed against 17,700 of collateral at 5,900,000
        BigDecimal debt = LoanMath.debtToClearForTarget(16_200L, 300_000L, 5_900_000L, SIXTY);
        assertEquals(0, new BigDecimal("13950").compareTo(debt));

        long sold = LoanMath.collateralToCover(debt, 5_900_000L);
        long remainingDebt = 16_200L - debt.longValue();
        long remainingCollateral = 300_000L - sold;
        assertEquals(2_250L, remainingDebt);
        assertEquals(63_559L, remainingCollateral);
        BigDecimal ltvAfter = LoanMath.currentLtv(remainingDebt, remainingCollateral, 5_900_000L);
        assertTrue(ltvAfter.compareTo(new BigDecimal("60.01")) <= 0, "LTV after sale was " + ltvAfter);
    }

    @Test
    @DisplayName("No debt needs clearing when the loan is already at or below target")
    void debtToClearBelowTarget() {
        assertEquals(0, BigDecimal.ZERO.compareTo(
            LoanMath.debtToClearForTarget(10_000L, 300_000L, 9_000_000L, SIXTY)));
    }
}
