package com.flagship.lending_ledger.loan.operation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanOperationRepository extends JpaRepository<LoanOperationEntity, UUID> {

    List<LoanOperationEntity> findByAccountIdOrderBySequenceNumberDesc(UUID accountId);

    List<LoanOperationEntity> findByAccountIdAndLoanIdOrderBySequenceNumberDesc(UUID accountId, UUID loanId);
}
