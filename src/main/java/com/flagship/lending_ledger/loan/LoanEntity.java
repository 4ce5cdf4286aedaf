package com.flagship.lending_ledger.loan;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for loan persistence.
 *
 * No setters: state only changes through {@link #updateFromDomain(Loan)}, so every write
 * has passed the transition checks in {@link Loan}. Identity, owner, rates and creation
 * time are not updatable.
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "collateral_amount", nullable = false)
    private long collateralAmount;

    @Column(name = "borrowed_amount", nullable = false)
    private long borrowedAmount;

    @Column(nullable = false)
    private long principal;

    @Column(name = "interest_accrued", nullable = false)
    private long interestAccrued;

    @Column(name = "ltv_ratio", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal ltvRatio;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "liquidation_price", nullable = false)
    private long liquidationPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanStatus status;

    @Column(name = "last_accrued_on")
    private LocalDate lastAccruedOn;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getAccountId(),
            loan.getCollateralAmount(),
            loan.getBorrowedAmount(),
            loan.getPrincipal(),
            loan.getInterestAccrued(),
            loan.getLtvRatio(),
            loan.getInterestRate(),
            loan.getLiquidationPrice(),
            loan.getStatus(),
            loan.getLastAccruedOn(),
            loan.getCreatedAt(),
            loan.getUpdatedAt(),
            loan.getClosedAt()
        );
    }

    public Loan toDomain() {
        return Loan.builder()
            .id(id)
            .accountId(accountId)
            .collateralAmount(collateralAmount)
            .borrowedAmount(borrowedAmount)
            .principal(principal)
            .interestAccrued(interestAccrued)
            .ltvRatio(ltvRatio)
            .interestRate(interestRate)
            .liquidationPrice(liquidationPrice)
            .status(status)
            .lastAccruedOn(lastAccruedOn)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .closedAt(closedAt)
            .build();
    }

    /**
     * Copies the mutable state of a transitioned domain loan onto this row.
     *
     * @throws IllegalStateException if this row is already terminal or the loan is a different one
     */
    void updateFromDomain(Loan loan) {
        if (!this.id.equals(loan.getId())) {
            throw new IllegalStateException(
                "Cannot apply state of loan " + loan.getId() + " to loan " + this.id);
        }
        if (this.status != LoanStatus.ACTIVE) {
            throw new IllegalStateException(
                "Loan " + this.id + " is " + this.status + " and can no longer change");
        }
        this.collateralAmount = loan.getCollateralAmount();
        this.borrowedAmount = loan.getBorrowedAmount();
        this.principal = loan.getPrincipal();
        this.interestAccrued = loan.getInterestAccrued();
        this.liquidationPrice = loan.getLiquidationPrice();
        this.status = loan.getStatus();
        this.lastAccruedOn = loan.getLastAccruedOn();
        this.updatedAt = loan.getUpdatedAt();
        this.closedAt = loan.getClosedAt();
    }
}
