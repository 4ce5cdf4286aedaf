package com.flagship.lending_ledger.loan;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for loan persistence.
 *
 * The *ForUpdate finders take a pessimistic write lock (SELECT ... FOR UPDATE). Callers lock
 * the owning account's balance row first.
 */
@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.accountId = :accountId AND l.status = :status")
    Optional<LoanEntity> findByAccountIdAndStatusForUpdate(@Param("accountId") UUID accountId,
                                                           @Param("status") LoanStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.id = :id")
    Optional<LoanEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<LoanEntity> findByAccountIdAndStatus(UUID accountId, LoanStatus status);

    @Query("SELECT l.accountId FROM LoanEntity l WHERE l.id = :id")
    Optional<UUID> findAccountIdById(@Param("id") UUID id);

    /**
     * Loans the risk monitor has to look at: open, with debt and collateral.
     */
    @Query("""
        SELECT l.id FROM LoanEntity l
        WHERE l.status = com.flagship.lending_ledger.loan.LoanStatus.ACTIVE
          AND l.borrowedAmount > 0
          AND l.collateralAmount > 0
        ORDER BY l.createdAt ASC
        """)
    List<UUID> findMonitoredLoanIds();

    /**
     * Loans the daily accrual applies to.
     */
    @Query("""
        SELECT l.id FROM LoanEntity l
        WHERE l.status = com.flagship.lending_ledger.loan.LoanStatus.ACTIVE
          AND l.borrowedAmount > 0
        ORDER BY l.createdAt ASC
        """)
    List<UUID> findAccruingLoanIds();

    @Query("""
        SELECT l FROM LoanEntity l
        WHERE l.status = com.flagship.lending_ledger.loan.LoanStatus.ACTIVE
          AND l.borrowedAmount > 0
        """)
    List<LoanEntity> findActiveWithDebt();

    long countByStatus(LoanStatus status);
}
