package com.fintech.webhook.domain.service;

import com.fintech.webhook.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.webhook.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Outbox publisher for applied bank transactions.
 *
 * Polls outbox_events and publishes pending events to Kafka, keyed by the
 * bank transaction id.
 *
 * Failure Handling:
 * - Kafka publish fails: event stays PENDING and is retried on the next poll
 * - Retry budget spent: event is parked as FAILED for manual replay
 * - Service crashes: PENDING events are picked up after restart
 * - Duplicate publish: downstream consumers must be idempotent on the key
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${app.kafka.topics.transaction-events}")
    private String transactionEventsTopic;

    @Value("${app.outbox.max-retries:5}")
    private int maxRetries;

    @Value("${app.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:500}")
    public void publishPendingEvents() {
        List<OutboxEventEntity> pendingEvents;
        try {
            pendingEvents = outboxEventRepository.findTop50ByStatusOrderByCreatedAtAsc(OutboxEventEntity.EventStatus.PENDING);
        } catch (Exception e) {
            log.error("Could not read pending outbox events: {}", e.getMessage(), e);
            return;
        }

        if (pendingEvents.isEmpty()) {
            return;
        }

        log.debug("Publishing {} pending outbox events", pendingEvents.size());

        for (OutboxEventEntity event : pendingEvents) {
            try {
                kafkaTemplate.send(transactionEventsTopic, event.getTransactionId(), event.getPayload())
                        .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
                event.markPublished();
                log.debug("Published outbox event {} ({}) to topic {}",
                        event.getEventId(), event.getEventType(), transactionEventsTopic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                event.markFailed("interrupted", maxRetries);
                outboxEventRepository.save(event);
                return;
            } catch (Exception e) {
                event.markFailed(e.getMessage(), maxRetries);
                log.error("Failed to publish outbox event {} for transaction {} (attempt {}): {}",
                        event.getEventId(), event.getTransactionId(), event.getRetryCount(), e.getMessage());
            }
            outboxEventRepository.save(event);
        }
    }
}
