package com.flagship.lending_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_ledger.loan.event.LoanEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes loan events to the outbox inside the business transaction.
 *
 * If the loan change commits, its event is guaranteed to be stored; if it rolls back,
 * the event goes with it. Publication to Kafka is the {@link OutboxPublisher}'s job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String LOAN_AGGREGATE = "Loan";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves a loan event within the caller's transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LoanEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
            LOAN_AGGREGATE, event.getLoanId(), event.getEventType(), serializePayload(event));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, loanId={}", event.getEventType(), event.getLoanId());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForLoan(UUID loanId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(LOAN_AGGREGATE, loanId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int deleted = repository.deletePublishedEventsBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
