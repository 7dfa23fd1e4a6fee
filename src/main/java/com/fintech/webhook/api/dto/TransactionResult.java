package com.fintech.webhook.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResult {

    private String transactionId;

    /** 01 success, 02 failed without detail, 03 resend requested, 04 failed with reason. */
    private String errorCode;

    private String description;

    @Builder.Default
    private Map<String, Object> additionalInfo = new LinkedHashMap<>();
}
