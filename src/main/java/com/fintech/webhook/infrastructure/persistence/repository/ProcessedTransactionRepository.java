package com.fintech.webhook.infrastructure.persistence.repository;

import com.fintech.webhook.infrastructure.persistence.entity.ProcessedTransactionEntity;
import com.fintech.webhook.infrastructure.persistence.entity.ProcessedTransactionEntity.Status;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface ProcessedTransactionRepository extends JpaRepository<ProcessedTransactionEntity, String> {

    interface ProcessedIdView {
        String getTransactionId();

        Instant getProcessedAt();
    }

    /**
     * Claims a transaction id with a plain INSERT.
     *
     * The primary key makes this the compare-and-set of the duplicate index:
     * a second claim for the same id fails with a duplicate key error, whichever
     * instance issues it. Runs in its own transaction so the claim is visible
     * to other instances as soon as it returns.
     */
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO processed_transactions (transaction_id, batch_id, status, reserved_at) "
            + "VALUES (:transactionId, :batchId, 'RESERVED', :reservedAt)", nativeQuery = true)
    int reserve(@Param("transactionId") String transactionId,
                @Param("batchId") String batchId,
                @Param("reservedAt") Instant reservedAt);

    /**
     * Flips a reservation to PROCESSED. Joins the caller's transaction.
     */
    @Modifying
    @Query("UPDATE ProcessedTransactionEntity p SET p.status = :processed, p.processedAt = :processedAt "
            + "WHERE p.transactionId = :transactionId AND p.status = :reserved")
    int markProcessed(@Param("transactionId") String transactionId,
                      @Param("processedAt") Instant processedAt,
                      @Param("processed") Status processed,
                      @Param("reserved") Status reserved);

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedTransactionEntity p WHERE p.transactionId = :transactionId AND p.status = :status")
    int deleteByTransactionIdAndStatus(@Param("transactionId") String transactionId, @Param("status") Status status);

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedTransactionEntity p WHERE p.status = :status AND p.reservedAt < :cutoff")
    int deleteReservationsOlderThan(@Param("status") Status status, @Param("cutoff") Instant cutoff);

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedTransactionEntity p WHERE p.status = :status AND p.processedAt < :cutoff")
    int deleteProcessedOlderThan(@Param("status") Status status, @Param("cutoff") Instant cutoff);

    boolean existsByTransactionIdAndStatus(String transactionId, Status status);

    List<ProcessedIdView> findByStatusAndProcessedAtGreaterThanEqual(Status status, Instant since);

    long countByStatus(Status status);

    @Query("SELECT MIN(p.processedAt) FROM ProcessedTransactionEntity p WHERE p.status = :status")
    Instant findOldestProcessedAt(@Param("status") Status status);

    @Query("SELECT MAX(p.processedAt) FROM ProcessedTransactionEntity p WHERE p.status = :status")
    Instant findNewestProcessedAt(@Param("status") Status status);
}
