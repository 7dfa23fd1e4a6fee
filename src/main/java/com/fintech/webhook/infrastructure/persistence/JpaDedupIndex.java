package com.fintech.webhook.infrastructure.persistence;

import com.fintech.webhook.config.WebhookProperties;
import com.fintech.webhook.domain.model.DedupIndexStats;
import com.fintech.webhook.domain.service.DedupIndex;
import com.fintech.webhook.domain.service.DedupIndexUnavailableException;
import com.fintech.webhook.infrastructure.persistence.repository.ProcessedTransactionRepository;
import com.fintech.webhook.infrastructure.persistence.repository.ProcessedTransactionRepository.ProcessedIdView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.fintech.webhook.infrastructure.persistence.entity.ProcessedTransactionEntity.Status.PROCESSED;
import static com.fintech.webhook.infrastructure.persistence.entity.ProcessedTransactionEntity.Status.RESERVED;

/**
 * Database-backed duplicate index.
 *
 * Why Database-Backed?
 * - Survives restarts
 * - Shared by every gateway instance
 * - The primary key on transaction_id gives an atomic claim per id
 *
 * Processed ids of the retention window are loaded into
 * {@link ProcessedTransactionCache} at startup so repeated ids are rejected
 * without a round trip.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaDedupIndex implements DedupIndex {

    private final ProcessedTransactionRepository repository;
    private final ProcessedTransactionCache cache;
    private final WebhookProperties properties;
    private final Clock clock;

    /**
     * Rebuilds the in-memory cache from the retention window.
     * A failure leaves the cache empty; lookups then go to the database.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        Instant since = clock.instant().minus(retention());
        try {
            List<ProcessedIdView> recent = repository.findByStatusAndProcessedAtGreaterThanEqual(PROCESSED, since);
            Map<String, Instant> entries = new HashMap<>();
            for (ProcessedIdView view : recent) {
                entries.put(view.getTransactionId(), view.getProcessedAt());
            }
            cache.putAll(entries);
            log.info("Loaded {} processed transaction ids since {}", entries.size(), since);
        } catch (DataAccessException e) {
            log.error("Could not load processed transaction ids, cache starts empty: {}", e.getMessage(), e);
        }
    }

    @Override
    public boolean isProcessed(String transactionId) {
        if (cache.contains(transactionId)) {
            return true;
        }
        try {
            boolean processed = repository.existsByTransactionIdAndStatus(transactionId, PROCESSED);
            if (processed) {
                // Processed by another instance or before the retention window
                cache.add(transactionId, clock.instant());
            }
            return processed;
        } catch (DataAccessException e) {
            throw new DedupIndexUnavailableException("Duplicate lookup failed for " + transactionId, e);
        }
    }

    @Override
    public boolean tryReserve(String transactionId, String batchId) {
        try {
            return repository.reserve(transactionId, batchId, clock.instant()) == 1;
        } catch (DataIntegrityViolationException e) {
            return handleRejectedClaim(transactionId, e);
        } catch (DataAccessException e) {
            throw new DedupIndexUnavailableException("Reservation failed for " + transactionId, e);
        }
    }

    /**
     * Only an existing row for the id counts as a lost claim. Any other integrity
     * error (oversized value, constraint on another column) is a store fault.
     */
    private boolean handleRejectedClaim(String transactionId, DataIntegrityViolationException e) {
        boolean exists;
        try {
            exists = repository.existsById(transactionId);
        } catch (DataAccessException lookupFailure) {
            e.addSuppressed(lookupFailure);
            throw new DedupIndexUnavailableException("Reservation failed for " + transactionId, e);
        }
        if (exists) {
            log.info("Transaction {} already claimed, rejecting as duplicate", transactionId);
            return false;
        }
        throw new DedupIndexUnavailableException("Reservation rejected by the store for " + transactionId, e);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void markProcessed(String transactionId) {
        Instant processedAt = clock.instant();
        int updated = repository.markProcessed(transactionId, processedAt, PROCESSED, RESERVED);
        if (updated != 1) {
            throw new IllegalStateException("No live reservation for transaction " + transactionId);
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache.add(transactionId, processedAt);
            }
        });
    }

    @Override
    public void release(String transactionId) {
        try {
            repository.deleteByTransactionIdAndStatus(transactionId, RESERVED);
            log.debug("Released reservation for transaction {}", transactionId);
        } catch (DataAccessException e) {
            // The id stays claimed until the lease sweep removes it
            log.warn("Could not release reservation for {}, leaving it to the lease sweep: {}",
                    transactionId, e.getMessage());
        }
    }

    @Override
    public DedupIndexStats stats() {
        return DedupIndexStats.builder()
                .totalProcessed(repository.countByStatus(PROCESSED))
                .pendingReservations(repository.countByStatus(RESERVED))
                .cachedIds(cache.size())
                .oldestProcessedAt(repository.findOldestProcessedAt(PROCESSED))
                .newestProcessedAt(repository.findNewestProcessedAt(PROCESSED))
                .retentionDays(properties.getDedup().getRetentionDays())
                .build();
    }

    @Override
    public int purgeProcessedOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int purged = repository.deleteProcessedOlderThan(PROCESSED, cutoff);
        int evicted = cache.evictOlderThan(cutoff);
        log.info("Purged {} processed transaction ids older than {} ({} evicted from cache)", purged, cutoff, evicted);
        return purged;
    }

    @Override
    public int releaseReservationsOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int released = repository.deleteReservationsOlderThan(RESERVED, cutoff);
        if (released > 0) {
            log.warn("Released {} abandoned reservations older than {}", released, cutoff);
        }
        return released;
    }

    private Duration retention() {
        return Duration.ofDays(properties.getDedup().getRetentionDays());
    }
}
