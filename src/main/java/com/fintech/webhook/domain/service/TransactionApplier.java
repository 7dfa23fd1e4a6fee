package com.fintech.webhook.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.webhook.domain.model.TransactionAppliedEvent;
import com.fintech.webhook.domain.model.TransactionRecord;
import com.fintech.webhook.domain.model.TransactionType;
import com.fintech.webhook.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.webhook.infrastructure.persistence.repository.OutboxEventRepository;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Business effect of a bank transaction.
 *
 * Processing Flow (single database transaction):
 * 1. Derive the applied event from the transaction type
 * 2. Write it to the outbox (published to Kafka by {@link OutboxPublisher})
 * 3. Flip the duplicate-index reservation to PROCESSED
 *
 * Either all three commit or none does, so a transaction is never marked
 * processed without its event, and never emits an event twice.
 *
 * Failure Handling:
 * - Transient database errors: retried (resilience4j "transactionApply")
 * - Anything else: propagates; the caller releases the reservation
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionApplier {

    private final OutboxEventRepository outboxEventRepository;
    private final DedupIndex dedupIndex;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(timeout = 5)
    @Retry(name = "transactionApply")
    public TransactionAppliedEvent apply(TransactionRecord record, String batchId) {
        TransactionType type = record.getTransactionType()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported transaction type: " + record.getTransactionTypeCode()));

        TransactionAppliedEvent event = TransactionAppliedEvent.builder()
                .transactionId(record.getTransactionId())
                .transactionRefNo(record.getTransactionRefNo())
                .batchId(batchId)
                .accountNumber(record.getSourceAccountNumber())
                .amount(record.getAmount())
                .availableBalance(record.getAvailableBalance())
                .type(type)
                .description(record.getTransDesc())
                .counterpartyAccountNumber(record.getOfsAccountNumber())
                .counterpartyAccountName(record.getOfsAccountName())
                .counterpartyBankId(record.getOfsBankId())
                .appliedAt(Instant.now(clock))
                .build();

        outboxEventRepository.save(OutboxEventEntity.builder()
                .eventType(type.getEventType())
                .transactionId(record.getTransactionId())
                .batchId(batchId)
                .payload(toJson(event))
                .build());

        dedupIndex.markProcessed(record.getTransactionId());

        log.debug("Applied {} {} for batch {}", type, record.getTransactionId(), batchId);
        return event;
    }

    private String toJson(TransactionAppliedEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize applied event for " + event.getTransactionId(), e);
        }
    }
}
