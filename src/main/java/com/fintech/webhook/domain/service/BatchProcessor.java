package com.fintech.webhook.domain.service;

import com.fintech.webhook.domain.model.BatchResult;
import com.fintech.webhook.domain.model.NotificationBatch;
import com.fintech.webhook.domain.model.ProcessingOutcome;
import com.fintech.webhook.domain.model.SharedDependency;
import com.fintech.webhook.domain.model.TransactionRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies every transaction of an admitted batch at most once.
 *
 * Processing Flow (per transaction, independently):
 * 1. Duplicate check against the dedup index
 * 2. Field validation
 * 3. Atomic reservation of the transaction id
 * 4. Apply (outbox event + mark processed, one database transaction)
 *
 * A failing transaction never stops the rest of the batch. Outcomes are
 * returned in the input order of the batch.
 *
 * Failure Handling:
 * - Already processed or claimed: DUPLICATE_REJECTED, nothing touched
 * - Rule violations: VALIDATION_FAILED with every violated rule
 * - Dedup store unreachable: PROCESSING_ERROR, not applied (fail closed)
 * - Apply throws: PROCESSING_ERROR, reservation released, not marked processed
 * - Null entry: VALIDATION_FAILED, nothing touched
 * - Any other fault: PROCESSING_ERROR for that entry only
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchProcessor {

    static final String EMPTY_ENTRY = "Transaction entry must not be null";

    private final DedupIndex dedupIndex;
    private final TransactionValidator validator;
    private final TransactionApplier applier;
    private final MeterRegistry meterRegistry;

    public BatchResult processBatch(NotificationBatch batch) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<TransactionRecord> records = batch.getTransactions() == null ? List.of() : batch.getTransactions();

        List<ProcessingOutcome> outcomes = new ArrayList<>(records.size());
        for (TransactionRecord record : records) {
            ProcessingOutcome outcome = processTransaction(record, batch.getBatchId());
            outcomes.add(outcome);

            Counter.builder("webhook.transactions.processed")
                    .tag("result", outcome.getStatus().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
        }

        BatchResult result = new BatchResult(batch.getBatchId(), outcomes);

        sample.stop(Timer.builder("webhook.batch.processing.latency")
                .tag("outcome", result.isFullySuccessful() ? "success" : "partial_failure")
                .register(meterRegistry));

        log.info("Batch {} processed: {} of {} transactions applied, {} failed",
                batch.getBatchId(), result.getProcessedCount(), records.size(), result.getFailedCount());
        if (result.getFailedCount() > 0) {
            log.warn("Batch {} failed transactions: {}", batch.getBatchId(), result.getFailedTransactions());
        }
        return result;
    }

    private ProcessingOutcome processTransaction(TransactionRecord record, String batchId) {
        if (record == null) {
            log.warn("Batch {} contains an empty transaction entry", batchId);
            return ProcessingOutcome.validationFailed(null, List.of(EMPTY_ENTRY));
        }
        try {
            return processRecord(record, batchId);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing transaction {} (batch {}): {}",
                    record.getTransactionId(), batchId, e.getMessage(), e);
            return ProcessingOutcome.processingError(record.getTransactionId(), "Unexpected processing error");
        }
    }

    private ProcessingOutcome processRecord(TransactionRecord record, String batchId) {
        String transactionId = record.getTransactionId();

        try {
            // Step 1: Duplicate check
            if (transactionId != null && dedupIndex.isProcessed(transactionId)) {
                log.warn("Duplicate transaction detected: {} (batch {})", transactionId, batchId);
                return ProcessingOutcome.duplicate(transactionId);
            }

            // Step 2: Validation
            List<String> violations = validator.validate(record);
            if (!violations.isEmpty()) {
                log.warn("Transaction {} failed validation: {}", transactionId, violations);
                return ProcessingOutcome.validationFailed(transactionId, violations);
            }

            // Step 3: Claim the id; loses against a concurrent batch carrying the same id
            if (!dedupIndex.tryReserve(transactionId, batchId)) {
                log.warn("Transaction {} claimed concurrently, rejecting as duplicate (batch {})", transactionId, batchId);
                return ProcessingOutcome.duplicate(transactionId);
            }
        } catch (DedupIndexUnavailableException e) {
            log.error("Dedup index unavailable ({}), rejecting transaction {} unprocessed: {}",
                    SharedDependency.DEDUP_STORE.getPolicy(), transactionId, e.getMessage());
            return ProcessingOutcome.processingError(transactionId, "Duplicate check unavailable");
        }

        // Step 4: Apply
        try {
            applier.apply(record, batchId);
            log.info("Transaction processed successfully: {} (amount: {}, type: {}, batch: {})",
                    transactionId, record.getAmount(), record.getTransactionTypeCode(), batchId);
            return ProcessingOutcome.success(transactionId);
        } catch (Exception e) {
            log.error("Error applying transaction {}: {}", transactionId, e.getMessage(), e);
            dedupIndex.release(transactionId);
            return ProcessingOutcome.processingError(transactionId, e.getMessage());
        }
    }
}
