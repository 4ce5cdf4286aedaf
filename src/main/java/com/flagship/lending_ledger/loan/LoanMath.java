package com.flagship.lending_ledger.loan;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-point arithmetic for loan valuation.
 *
 * Amounts are integers in smallest units: crypto in 1/ASSET_SCALE of a whole unit,
 * base currency in its minor unit. Rates are base units per one whole crypto unit.
 * Intermediate products are carried in BigDecimal so nothing overflows or loses precision,
 * and every result that becomes an amount is rounded explicitly:
 * - borrowing capacity and sale proceeds round down (never over-credit)
 * - collateral to sell rounds up (never under-sell)
 * - interest rounds half-up
 */
public final class LoanMath {

    public static final long ASSET_SCALE = 100_000_000L;

    private static final BigDecimal SCALE = BigDecimal.valueOf(ASSET_SCALE);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);
    private static final int LTV_SCALE = 4;
    private static final int WORKING_SCALE = 8;

    private LoanMath() {
        // Utility class
    }

    /**
     * Value of the collateral in base units at the given sell rate (exact, 8 decimals).
     */
    public static BigDecimal collateralValue(long collateral, long sellRate) {
        return BigDecimal.valueOf(collateral)
            .multiply(BigDecimal.valueOf(sellRate))
            .divide(SCALE, WORKING_SCALE, RoundingMode.DOWN);
    }

    /**
     * floor(collateral * sellRate * ltvRatio / (100 * ASSET_SCALE))
     */
    public static long maxBorrowable(long collateral, long sellRate, BigDecimal ltvRatio) {
        return BigDecimal.valueOf(collateral)
            .multiply(BigDecimal.valueOf(sellRate))
            .multiply(ltvRatio)
            .divide(HUNDRED.multiply(SCALE), 0, RoundingMode.FLOOR)
            .longValueExact();
    }

    /**
     * Sell rate at which the loan reaches the liquidation threshold.
     * Zero when there is no debt or no collateral.
     */
    public static long liquidationPrice(long borrowed, long collateral, BigDecimal liquidationThreshold) {
        if (borrowed <= 0 || collateral <= 0) {
            return 0L;
        }
        BigDecimal numerator = BigDecimal.valueOf(borrowed).multiply(SCALE).multiply(HUNDRED);
        BigDecimal denominator = BigDecimal.valueOf(collateral).multiply(liquidationThreshold);
        return numerator.divide(denominator, 0, RoundingMode.FLOOR).longValueExact();
    }

    /**
     * Current loan-to-value as a percentage with four decimals.
     *
     * @throws IllegalArgumentException if there is debt but no collateral value to measure it against
     */
    public static BigDecimal currentLtv(long borrowed, long collateral, long sellRate) {
        if (borrowed <= 0) {
            return BigDecimal.ZERO.setScale(LTV_SCALE);
        }
        if (collateral <= 0 || sellRate <= 0) {
            throw new IllegalArgumentException(
                String.format("Cannot compute LTV for debt %d against collateral %d at rate %d",
                    borrowed, collateral, sellRate));
        }
        BigDecimal numerator = BigDecimal.valueOf(borrowed).multiply(HUNDRED).multiply(SCALE);
        BigDecimal denominator = BigDecimal.valueOf(collateral).multiply(BigDecimal.valueOf(sellRate));
        return numerator.divide(denominator, LTV_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Classifies the exact loan-to-value, not the rounded {@link #currentLtv} figure:
     * borrowed * 100 * ASSET_SCALE is compared with threshold * collateral * sellRate.
     */
    public static RiskStatus riskStatus(long borrowed, long collateral, long sellRate,
                                        BigDecimal warningThreshold, BigDecimal liquidationThreshold) {
        if (borrowed <= 0) {
            return RiskStatus.SAFE;
        }
        if (collateral <= 0 || sellRate <= 0) {
            return RiskStatus.LIQUIDATE;
        }
        BigDecimal scaledDebt = BigDecimal.valueOf(borrowed).multiply(HUNDRED).multiply(SCALE);
        BigDecimal value = BigDecimal.valueOf(collateral).multiply(BigDecimal.valueOf(sellRate));
        if (scaledDebt.compareTo(value.multiply(liquidationThreshold)) >= 0) {
            return RiskStatus.LIQUIDATE;
        }
        if (scaledDebt.compareTo(value.multiply(warningThreshold)) >= 0) {
            return RiskStatus.WARNING;
        }
        return RiskStatus.SAFE;
    }

    /**
     * Whole days between loan creation and now, never negative.
     */
    public static long daysElapsed(Instant createdAt, Instant now) {
        long days = Duration.between(createdAt, now).toDays();
        return Math.max(0L, days);
    }

    /**
     * round_half_up(principal * rate/100 * days/365)
     */
    public static long interestFor(long principal, BigDecimal annualRate, long days) {
        return BigDecimal.valueOf(principal)
            .multiply(annualRate)
            .multiply(BigDecimal.valueOf(days))
            .divide(HUNDRED.multiply(DAYS_PER_YEAR), 0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    /**
     * Interest for one day on the outstanding balance.
     */
    public static long dailyInterest(long borrowed, BigDecimal annualRate) {
        return interestFor(borrowed, annualRate, 1L);
    }

    /**
     * Smallest crypto amount whose sale covers the given base amount: ceil(amount * ASSET_SCALE / sellRate).
     */
    public static long collateralToCover(BigDecimal baseAmount, long sellRate) {
        if (baseAmount.signum() <= 0) {
            return 0L;
        }
        return baseAmount.multiply(SCALE)
            .divide(BigDecimal.valueOf(sellRate), 0, RoundingMode.CEILING)
            .longValueExact();
    }

    public static long collateralToCover(long baseAmount, long sellRate) {
        return collateralToCover(BigDecimal.valueOf(baseAmount), sellRate);
    }

    /**
     * Base proceeds from selling crypto at the sell rate: floor(crypto * sellRate / ASSET_SCALE).
     */
    public static long saleProceeds(long crypto, long sellRate) {
        return BigDecimal.valueOf(crypto)
            .multiply(BigDecimal.valueOf(sellRate))
            .divide(SCALE, 0, RoundingMode.FLOOR)
            .longValueExact();
    }

    /**
     * Debt that has to be cleared by a sale so that the post-sale LTV lands on the target.
     *
     * Selling collateral reduces debt and collateral value by the same amount, so clearing
     * (borrowed - target*value) alone would leave the loan well above target. Solving
     * (borrowed - x) / (value - x) = target gives x = (borrowed - target*value) / (1 - target).
     * Returns zero when the loan is already at or below target.
     */
    public static BigDecimal debtToClearForTarget(long borrowed, long collateral, long sellRate,
                                                  BigDecimal targetLtv) {
        BigDecimal target = targetLtv.divide(HUNDRED, WORKING_SCALE, RoundingMode.HALF_UP);
        BigDecimal targetBorrowed = collateralValue(collateral, sellRate).multiply(target);
        BigDecimal excess = BigDecimal.valueOf(borrowed).subtract(targetBorrowed);
        if (excess.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal retained = BigDecimal.ONE.subtract(target);
        if (retained.signum() <= 0) {
            return BigDecimal.valueOf(borrowed);
        }
        return excess.divide(retained, WORKING_SCALE, RoundingMode.UP);
    }
}
