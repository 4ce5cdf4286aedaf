package com.flagship.lending_ledger.loan.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for loan events published through the outbox.
 *
 * Events are facts about a loan that downstream consumers (notifications, reporting)
 * react to. They carry the loan ID as aggregate ID so all events of one loan land on
 * the same partition, in order.
 */
public interface LoanEvent {

    /**
     * Unique identifier for this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getLoanId();

    UUID getAccountId();

    Instant getOccurredAt();

    String getEventType();
}
