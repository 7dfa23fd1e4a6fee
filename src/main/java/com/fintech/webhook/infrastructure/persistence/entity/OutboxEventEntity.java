package com.fintech.webhook.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Applied-transaction event waiting to be published to Kafka.
 *
 * Written in the same database transaction that marks the bank transaction
 * as processed, so an event exists if and only if the transaction was applied.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    private UUID eventId;

    @Column(nullable = false, length = 50)
    private String eventType;

    /** Bank transaction id; used as the Kafka record key. */
    @Column(nullable = false, length = 255)
    private String transactionId;

    @Column(columnDefinition = "TEXT")
    private String batchId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column
    @Builder.Default
    private Integer retryCount = 0;

    @Column(length = 500)
    private String errorMessage;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }

    public void markPublished() {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = Instant.now();
    }

    /**
     * Failed publishes go back to PENDING until the retry budget is spent.
     */
    public void markFailed(String error, int maxRetries) {
        this.retryCount++;
        this.errorMessage = error == null ? null : error.substring(0, Math.min(error.length(), 500));
        this.status = retryCount >= maxRetries ? EventStatus.FAILED : EventStatus.PENDING;
    }
}
