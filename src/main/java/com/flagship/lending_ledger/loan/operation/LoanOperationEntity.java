package com.flagship.lending_ledger.loan.operation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for loan_operations. Insert-only: the table rejects updates and deletes.
 */
@Entity
@Immutable
@Table(name = "loan_operations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanOperationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, updatable = false, length = 30)
    private OperationType operationType;

    @Column(name = "base_amount", nullable = false, updatable = false)
    private long baseAmount;

    @Column(name = "crypto_amount", nullable = false, updatable = false)
    private long cryptoAmount;

    @Column(name = "execution_rate", updatable = false)
    private Long executionRate;

    @Column(name = "details", columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> details;

    @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static LoanOperationEntity fromDomain(LoanOperation operation) {
        return new LoanOperationEntity(
            operation.getId(),
            operation.getLoanId(),
            operation.getAccountId(),
            operation.getType(),
            operation.getBaseAmount(),
            operation.getCryptoAmount(),
            operation.getExecutionRate(),
            operation.getDetails(),
            operation.getNotes(),
            operation.getCreatedAt(),
            null // assigned by the database
        );
    }

    public LoanOperation toDomain() {
        return LoanOperation.builder()
            .id(id)
            .loanId(loanId)
            .accountId(accountId)
            .type(operationType)
            .baseAmount(baseAmount)
            .cryptoAmount(cryptoAmount)
            .executionRate(executionRate)
            .details(details)
            .notes(notes)
            .createdAt(createdAt)
            .sequenceNumber(sequenceNumber)
            .build();
    }
}
