package com.flagship.lending_ledger.loan.operation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of a loan's append-only audit trail.
 *
 * baseAmount and cryptoAmount are magnitudes; the type says which way they moved.
 * executionRate is the sell rate the operation used, null when none was needed.
 */
@Value
@Builder
public class LoanOperation {
    UUID id;
    UUID loanId;
    UUID accountId;
    OperationType type;
    long baseAmount;
    long cryptoAmount;
    Long executionRate;
    Map<String, Object> details;
    String notes;
    Instant createdAt;
    Long sequenceNumber;
}
