package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Loan domain object and LoanEntity.
 *
 * Locking finders require an open transaction; the lock is held until it ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPersistenceService {

    private final LoanRepository loanRepository;

    /**
     * Inserts a new loan and flushes, so the one-active-loan index is checked right here.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan create(Loan loan) {
        try {
            LoanEntity saved = loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));
            log.debug("Saved loan {} for account {}", saved.getId(), saved.getAccountId());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new LendingException(LendingErrorCode.LOAN_ALREADY_ACTIVE,
                "Account " + loan.getAccountId() + " already has an active loan", e);
        }
    }

    /**
     * Writes a transitioned loan back to its locked row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan update(Loan loan) {
        LoanEntity existing = loanRepository.findById(loan.getId())
            .orElseThrow(() -> new LendingException(LendingErrorCode.LOAN_NOT_FOUND, "Loan not found: " + loan.getId()));
        existing.updateFromDomain(loan);
        LoanEntity updated = loanRepository.save(existing);
        log.debug("Updated loan {} status={}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Loan> lockActiveLoan(UUID accountId) {
        return loanRepository.findByAccountIdAndStatusForUpdate(accountId, LoanStatus.ACTIVE)
            .map(LoanEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Loan> lockLoan(UUID loanId) {
        return loanRepository.findByIdForUpdate(loanId)
            .map(LoanEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findActiveLoan(UUID accountId) {
        return loanRepository.findByAccountIdAndStatus(accountId, LoanStatus.ACTIVE)
            .map(LoanEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findById(UUID loanId) {
        return loanRepository.findById(loanId)
            .map(LoanEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findAccountId(UUID loanId) {
        return loanRepository.findAccountIdById(loanId);
    }

    @Transactional(readOnly = true)
    public List<Loan> findActiveWithDebt() {
        return loanRepository.findActiveWithDebt().stream()
            .map(LoanEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findMonitoredLoanIds() {
        return loanRepository.findMonitoredLoanIds();
    }

    @Transactional(readOnly = true)
    public List<UUID> findAccruingLoanIds() {
        return loanRepository.findAccruingLoanIds();
    }
}
