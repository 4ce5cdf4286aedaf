package com.flagship.lending_ledger.loan.operation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Append-only operation log for loans.
 *
 * Records are written in the same transaction as the change they describe
 * (MANDATORY propagation): if the operation rolls back, so does its record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanOperationLog {

    private final LoanOperationRepository repository;

    @Transactional(propagation = Propagation.MANDATORY)
    public LoanOperation append(LoanOperation operation) {
        if (operation.getBaseAmount() < 0 || operation.getCryptoAmount() < 0) {
            throw new IllegalArgumentException(
                String.format("Operation amounts are magnitudes and cannot be negative: base=%d, crypto=%d",
                    operation.getBaseAmount(), operation.getCryptoAmount()));
        }
        LoanOperationEntity saved = repository.save(LoanOperationEntity.fromDomain(operation));
        log.debug("Appended loan operation: type={}, loanId={}, base={}, crypto={}",
            operation.getType(), operation.getLoanId(), operation.getBaseAmount(), operation.getCryptoAmount());
        return saved.toDomain();
    }

    /**
     * Operation records of an account, newest first, optionally narrowed to one loan.
     */
    @Transactional(readOnly = true)
    public List<LoanOperation> history(UUID accountId, UUID loanId) {
        List<LoanOperationEntity> entities = loanId == null
            ? repository.findByAccountIdOrderBySequenceNumberDesc(accountId)
            : repository.findByAccountIdAndLoanIdOrderBySequenceNumberDesc(accountId, loanId);
        return entities.stream()
            .map(LoanOperationEntity::toDomain)
            .toList();
    }
}
