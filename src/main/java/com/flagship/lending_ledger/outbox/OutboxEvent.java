package com.flagship.lending_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A loan event waiting in the outbox for publication to Kafka.
 *
 * Written in the same transaction as the loan change it describes and published
 * afterwards by {@link OutboxPublisher}, so an event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * An event that failed this many times stops being retried and waits for an operator.
     */
    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
