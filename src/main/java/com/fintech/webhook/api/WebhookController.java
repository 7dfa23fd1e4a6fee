package com.fintech.webhook.api;

import com.fintech.webhook.api.dto.WebhookResponse;
import com.fintech.webhook.domain.model.BatchResult;
import com.fintech.webhook.domain.model.NotificationBatch;
import com.fintech.webhook.domain.model.PipelineRejection;
import com.fintech.webhook.domain.service.BatchProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives balance-change notifications pushed by the bank.
 *
 * Requests only get here after the admission filter has rate limited,
 * network checked and signature verified them. The outcome is always
 * reported in the envelope with HTTP 200.
 */
@Slf4j
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
public class WebhookController {

    private final BatchProcessor batchProcessor;
    private final ResponseComposer responseComposer;

    /**
     * POST /webhook/bank-notification
     */
    @PostMapping("/bank-notification")
    public ResponseEntity<WebhookResponse> receiveNotification(@RequestBody NotificationBatch batch) {
        int size = batch.getTransactions() == null ? 0 : batch.getTransactions().size();
        log.info("Received notification batch {} from {} with {} transactions",
                batch.getBatchId(), batch.getSourceAppId(), size);

        if (size == 0) {
            return ResponseEntity.ok(responseComposer.reject(
                    batch.getBatchId(), PipelineRejection.MALFORMED_BODY, "No transactions in batch"));
        }

        BatchResult result = batchProcessor.processBatch(batch);
        return ResponseEntity.ok(responseComposer.compose(result));
    }
}
