package com.fintech.webhook.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope returned for every webhook request, successful or not.
 * Always delivered with HTTP 200; {@code code} carries the real status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {

    private String batchId;
    private String code;
    private String message;

    @Builder.Default
    private List<TransactionResult> data = new ArrayList<>();
}
