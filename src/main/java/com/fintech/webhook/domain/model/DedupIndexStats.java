package com.fintech.webhook.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DedupIndexStats {

    long totalProcessed;
    long pendingReservations;
    int cachedIds;
    Instant oldestProcessedAt;
    Instant newestProcessedAt;
    int retentionDays;
}
