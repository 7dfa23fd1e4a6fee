package com.fintech.webhook.domain.model;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregated outcome of one batch. Outcomes keep the input order of the batch.
 */
@Value
public class BatchResult {

    String batchId;
    List<ProcessingOutcome> outcomes;

    public BatchResult(String batchId, List<ProcessingOutcome> outcomes) {
        this.batchId = batchId;
        this.outcomes = List.copyOf(outcomes);
    }

    public int getProcessedCount() {
        return (int) outcomes.stream().filter(ProcessingOutcome::isSuccess).count();
    }

    public int getFailedCount() {
        return outcomes.size() - getProcessedCount();
    }

    /**
     * Failed transactions as (transactionId, reason) pairs, in input order.
     */
    public List<Map.Entry<String, String>> getFailedTransactions() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(outcome -> Map.entry(String.valueOf(outcome.getTransactionId()), outcome.describe()))
                .collect(Collectors.toList());
    }

    public boolean isFullySuccessful() {
        return !outcomes.isEmpty() && getFailedCount() == 0;
    }
}
