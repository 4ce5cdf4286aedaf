package com.flagship.lending_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Loan domain object.
 *
 * Immutable: every mutation returns a new Loan. Only ACTIVE loans can change;
 * REPAID and LIQUIDATED are terminal and reject every transition.
 *
 * borrowedAmount is the outstanding balance (principal plus charged interest, net of
 * repayments and liquidation proceeds). principal and interestAccrued are running totals
 * of everything ever borrowed and charged on this loan; the minimum-interest floor is
 * computed from them, never from the operation log.
 *
 * liquidationPrice is recomputed on every change to borrowedAmount or collateralAmount.
 */
@Value
@Builder(toBuilder = true)
public class Loan {
    UUID id;
    UUID accountId;
    long collateralAmount;
    long borrowedAmount;
    long principal;
    long interestAccrued;
    BigDecimal ltvRatio;
    BigDecimal interestRate;
    long liquidationPrice;
    LoanStatus status;
    LocalDate lastAccruedOn;
    Instant createdAt;
    Instant updatedAt;
    Instant closedAt;

    /**
     * Opens a new ACTIVE loan holding the deposited collateral and no debt.
     */
    public static Loan open(UUID accountId, long collateralAmount, BigDecimal ltvRatio,
                            BigDecimal interestRate, Instant now) {
        if (collateralAmount <= 0) {
            throw new IllegalArgumentException("Collateral amount must be positive: " + collateralAmount);
        }
        return Loan.builder()
            .id(UUID.randomUUID())
            .accountId(accountId)
            .collateralAmount(collateralAmount)
            .borrowedAmount(0L)
            .principal(0L)
            .interestAccrued(0L)
            .ltvRatio(ltvRatio)
            .interestRate(interestRate)
            .liquidationPrice(0L)
            .status(LoanStatus.ACTIVE)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public Loan borrow(long amount, BigDecimal liquidationThreshold, Instant now) {
        requireActive("borrow");
        requirePositive(amount, "Borrow amount");
        long borrowed = this.borrowedAmount + amount;
        return toBuilder()
            .borrowedAmount(borrowed)
            .principal(this.principal + amount)
            .liquidationPrice(LoanMath.liquidationPrice(borrowed, this.collateralAmount, liquidationThreshold))
            .updatedAt(now)
            .build();
    }

    /**
     * Adds interest to the outstanding balance.
     *
     * @param accrualDate date of the daily accrual run, or null for a one-off charge
     *                    (minimum-interest top-up) that must not move the accrual guard
     */
    public Loan chargeInterest(long amount, LocalDate accrualDate, BigDecimal liquidationThreshold, Instant now) {
        requireActive("charge interest on");
        if (amount < 0) {
            throw new IllegalArgumentException("Interest amount cannot be negative: " + amount);
        }
        long borrowed = this.borrowedAmount + amount;
        return toBuilder()
            .borrowedAmount(borrowed)
            .interestAccrued(this.interestAccrued + amount)
            .liquidationPrice(LoanMath.liquidationPrice(borrowed, this.collateralAmount, liquidationThreshold))
            .lastAccruedOn(accrualDate != null ? accrualDate : this.lastAccruedOn)
            .updatedAt(now)
            .build();
    }

    /**
     * Applies a repayment. A repayment that clears the balance closes the loan as REPAID
     * and releases all collateral.
     */
    public Loan repay(long amount, BigDecimal liquidationThreshold, Instant now) {
        requireActive("repay");
        requirePositive(amount, "Repay amount");
        if (amount > this.borrowedAmount) {
            throw new IllegalStateException(
                String.format("Repayment %d exceeds outstanding balance %d on loan %s",
                    amount, this.borrowedAmount, this.id));
        }
        long borrowed = this.borrowedAmount - amount;
        if (borrowed == 0) {
            return close(LoanStatus.REPAID, now);
        }
        return toBuilder()
            .borrowedAmount(borrowed)
            .liquidationPrice(LoanMath.liquidationPrice(borrowed, this.collateralAmount, liquidationThreshold))
            .updatedAt(now)
            .build();
    }

    public Loan addCollateral(long amount, BigDecimal liquidationThreshold, Instant now) {
        requireActive("add collateral to");
        requirePositive(amount, "Collateral amount");
        long collateral = this.collateralAmount + amount;
        return toBuilder()
            .collateralAmount(collateral)
            .liquidationPrice(LoanMath.liquidationPrice(this.borrowedAmount, collateral, liquidationThreshold))
            .updatedAt(now)
            .build();
    }

    /**
     * Applies a sale of collateral whose proceeds reduced the debt by a positive amount. The loan stays ACTIVE;
     * use {@link #liquidate(Instant)} when the sale ends it.
     */
    public Loan applyCollateralSale(long collateralSold, long debtCleared,
                                    BigDecimal liquidationThreshold, Instant now) {
        requireActive("sell collateral of");
        if (collateralSold <= 0 || collateralSold >= this.collateralAmount) {
            throw new IllegalStateException(
                String.format("Partial sale of %d must leave collateral on loan %s (held %d)",
                    collateralSold, this.id, this.collateralAmount));
        }
        if (debtCleared <= 0 || debtCleared >= this.borrowedAmount) {
            throw new IllegalStateException(
                String.format("Partial sale clearing %d must leave debt on loan %s (owed %d)",
                    debtCleared, this.id, this.borrowedAmount));
        }
        long collateral = this.collateralAmount - collateralSold;
        long borrowed = this.borrowedAmount - debtCleared;
        return toBuilder()
            .collateralAmount(collateral)
            .borrowedAmount(borrowed)
            .liquidationPrice(LoanMath.liquidationPrice(borrowed, collateral, liquidationThreshold))
            .updatedAt(now)
            .build();
    }

    /**
     * Closes the loan as LIQUIDATED. Remaining debt and collateral are zeroed on the loan;
     * the caller settles them on the account ledger.
     */
    public Loan liquidate(Instant now) {
        requireActive("liquidate");
        return close(LoanStatus.LIQUIDATED, now);
    }

    /**
     * Works out what closing the loan now would cost under the minimum-interest floor.
     */
    public RepaymentQuote quoteRepayment(Instant now, int minimumInterestDays) {
        long daysElapsed = LoanMath.daysElapsed(this.createdAt, now);
        long daysToCharge = Math.max(daysElapsed, minimumInterestDays);
        long minimumInterestDue = LoanMath.interestFor(this.principal, this.interestRate, daysToCharge);
        long shortfall = Math.max(0L, minimumInterestDue - this.interestAccrued);
        return new RepaymentQuote(
            this.principal,
            this.interestAccrued,
            daysElapsed,
            daysToCharge,
            minimumInterestDue,
            shortfall,
            this.borrowedAmount + shortfall
        );
    }

    public boolean isActive() {
        return this.status == LoanStatus.ACTIVE;
    }

    public boolean isTerminal() {
        return this.status == LoanStatus.REPAID || this.status == LoanStatus.LIQUIDATED;
    }

    public boolean canTransitionTo(LoanStatus targetStatus) {
        if (this.status == targetStatus) {
            return this.status == LoanStatus.ACTIVE;
        }
        return switch (this.status) {
            case ACTIVE -> true;
            case REPAID, LIQUIDATED -> false;
        };
    }

    private Loan close(LoanStatus terminalStatus, Instant now) {
        if (!canTransitionTo(terminalStatus)) {
            throw new IllegalStateException(
                String.format("Cannot move loan %s from %s to %s", this.id, this.status, terminalStatus));
        }
        return toBuilder()
            .status(terminalStatus)
            .collateralAmount(0L)
            .borrowedAmount(0L)
            .liquidationPrice(0L)
            .updatedAt(now)
            .closedAt(now)
            .build();
    }

    private void requireActive(String action) {
        if (this.status != LoanStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot %s loan %s in %s status. Only ACTIVE loans can change.",
                    action, this.id, this.status));
        }
    }

    private static void requirePositive(long amount, String label) {
        if (amount <= 0) {
            throw new IllegalArgumentException(label + " must be positive: " + amount);
        }
    }
}
