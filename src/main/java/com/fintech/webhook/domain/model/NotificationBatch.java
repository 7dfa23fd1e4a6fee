package com.fintech.webhook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One notification request pushed by the bank.
 *
 * batchId and timestamp are opaque strings: they are signed and echoed,
 * never parsed as dates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationBatch {

    private String sourceAppId;
    private String batchId;
    private String timestamp;
    private String signature;

    @JsonProperty("data")
    private List<TransactionRecord> transactions;
}
