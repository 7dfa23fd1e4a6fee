package com.fintech.webhook.domain.service;

import com.fintech.webhook.domain.model.DedupIndexStats;

import java.time.Duration;

/**
 * Persistent index of applied transaction ids.
 *
 * A transaction id moves through reserve, then markProcessed (or release).
 * tryReserve is atomic per id across every instance sharing the store: of two
 * concurrent callers at most one gets {@code true}.
 *
 * Store failures surface as {@link DedupIndexUnavailableException} and must be
 * treated as "not safe to apply".
 */
public interface DedupIndex {

    /**
     * @return true if the id has already been applied
     */
    boolean isProcessed(String transactionId);

    /**
     * Claims the id for processing.
     *
     * @return false if the id is already processed or claimed by someone else
     */
    boolean tryReserve(String transactionId, String batchId);

    /**
     * Marks a reserved id as applied. Must run inside the transaction that applies it.
     */
    void markProcessed(String transactionId);

    /**
     * Drops a reservation after a failed apply so a later retry can claim the id again.
     */
    void release(String transactionId);

    DedupIndexStats stats();

    /**
     * @return number of processed ids removed
     */
    int purgeProcessedOlderThan(Duration age);

    /**
     * @return number of abandoned reservations removed
     */
    int releaseReservationsOlderThan(Duration age);
}
