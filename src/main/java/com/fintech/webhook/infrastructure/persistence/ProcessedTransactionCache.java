package com.fintech.webhook.infrastructure.persistence;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory front of the duplicate index: processed ids and when they were processed.
 *
 * Only a read accelerator. A miss never means "not processed"; the persistent
 * index is always consulted on a miss. Guarded by a single mutex.
 */
@Component
public class ProcessedTransactionCache {

    private final Map<String, Instant> processedIds = new HashMap<>();

    public synchronized boolean contains(String transactionId) {
        return processedIds.containsKey(transactionId);
    }

    public synchronized void add(String transactionId, Instant processedAt) {
        processedIds.put(transactionId, processedAt);
    }

    public synchronized void putAll(Map<String, Instant> entries) {
        processedIds.putAll(entries);
    }

    /**
     * @return number of evicted ids
     */
    public synchronized int evictOlderThan(Instant cutoff) {
        int before = processedIds.size();
        processedIds.values().removeIf(processedAt -> processedAt.isBefore(cutoff));
        return before - processedIds.size();
    }

    public synchronized int size() {
        return processedIds.size();
    }
}
