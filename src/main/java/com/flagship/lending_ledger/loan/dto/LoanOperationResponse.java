package com.flagship.lending_ledger.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.loan.operation.LoanOperation;
import com.flagship.lending_ledger.loan.operation.OperationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LoanOperationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("operation_type")
    OperationType operationType;

    @JsonProperty("base_amount")
    long baseAmount;

    @JsonProperty("crypto_amount")
    long cryptoAmount;

    @JsonProperty("execution_rate")
    Long executionRate;

    @JsonProperty("details")
    Map<String, Object> details;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LoanOperationResponse from(LoanOperation operation) {
        return LoanOperationResponse.builder()
            .id(operation.getId())
            .loanId(operation.getLoanId())
            .operationType(operation.getType())
            .baseAmount(operation.getBaseAmount())
            .cryptoAmount(operation.getCryptoAmount())
            .executionRate(operation.getExecutionRate())
            .details(operation.getDetails())
            .notes(operation.getNotes())
            .createdAt(operation.getCreatedAt())
            .build();
    }
}
