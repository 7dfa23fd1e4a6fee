package com.fintech.webhook.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry of the persistent duplicate index.
 *
 * The transaction id is the primary key, so at most one row can exist per id
 * across every gateway instance. A row is inserted as RESERVED before the
 * transaction is applied and flipped to PROCESSED in the same database
 * transaction that applies it.
 */
@Entity
@Table(name = "processed_transactions", indexes = {
    @Index(name = "idx_processed_status_processed_at", columnList = "status,processedAt"),
    @Index(name = "idx_processed_status_reserved_at", columnList = "status,reservedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedTransactionEntity {

    /** Bounded by the validator's maximum transaction id length. */
    @Id
    @Column(length = 255)
    private String transactionId;

    @Column(columnDefinition = "TEXT")
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(nullable = false)
    private Instant reservedAt;

    @Column
    private Instant processedAt;

    public enum Status {
        RESERVED,
        PROCESSED
    }
}
