package com.flagship.lending_ledger.outbox;

import com.flagship.lending_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes loan events to Kafka.
 *
 * - Loan ID is the record key, so one loan's events stay ordered on one partition
 * - Each send waits for the broker ack before the event is marked published
 * - A failed send bumps the retry count; past max-retries the event is dead-lettered
 *   and excluded from polling until an operator resets it
 *
 * Delivery is at-least-once: a crash between ack and markPublished republishes the event,
 * so consumers deduplicate on eventId.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.loan-events:loan-events}")
    private String loanEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.publisher.retention:P7D}")
    private Duration retention;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Deletes published events past the retention window, once an hour.
     */
    @Scheduled(fixedDelayString = "${outbox.publisher.purge-interval-ms:3600000}")
    public void purgePublishedEvents() {
        try {
            outboxService.purgePublishedBefore(Instant.now().minus(retention));
        } catch (Exception e) {
            log.error("Outbox retention purge failed", e);
        }
    }

    void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate.send(loanEventsTopic, key, event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}) and is dead-lettered. eventType={}, loanId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
