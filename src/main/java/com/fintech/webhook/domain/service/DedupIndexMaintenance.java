package com.fintech.webhook.domain.service;

import com.fintech.webhook.config.WebhookProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic housekeeping of the duplicate index.
 *
 * <ul>
 *   <li>Reservations left behind by a crash between reserve and apply are
 *       released once their lease expires, so the bank can resend them.</li>
 *   <li>Processed ids older than the retention window are purged from the
 *       table and the in-memory cache.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupIndexMaintenance {

    private final DedupIndex dedupIndex;
    private final WebhookProperties properties;

    @Scheduled(fixedDelayString = "${app.webhook.dedup.reservation-sweep-interval-ms:60000}",
            initialDelayString = "${app.webhook.dedup.reservation-sweep-interval-ms:60000}")
    public void releaseAbandonedReservations() {
        try {
            dedupIndex.releaseReservationsOlderThan(
                    Duration.ofSeconds(properties.getDedup().getReservationLeaseSeconds()));
        } catch (Exception e) {
            log.error("Reservation sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${app.webhook.dedup.purge-cron:0 30 3 * * *}")
    public void purgeExpiredIds() {
        try {
            dedupIndex.purgeProcessedOlderThan(Duration.ofDays(properties.getDedup().getRetentionDays()));
        } catch (Exception e) {
            log.error("Retention purge of processed transaction ids failed: {}", e.getMessage(), e);
        }
    }
}
