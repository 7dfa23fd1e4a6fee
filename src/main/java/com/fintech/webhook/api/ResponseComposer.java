package com.fintech.webhook.api;

import com.fintech.webhook.api.dto.TransactionResult;
import com.fintech.webhook.api.dto.WebhookResponse;
import com.fintech.webhook.domain.model.BatchResult;
import com.fintech.webhook.domain.model.PipelineRejection;
import com.fintech.webhook.domain.model.ProcessingOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps internal outcomes to the envelope the bank expects.
 */
@Component
public class ResponseComposer {

    public static final String UNKNOWN_BATCH_ID = "unknown";

    public static final String CODE_BATCH_SUCCESS = "200";
    public static final String CODE_BATCH_PARTIAL_FAILURE = "400";

    /**
     * Per-transaction codes of the bank contract.
     */
    public enum ErrorCode {
        SUCCESS("01"),
        FAILED_NO_DETAIL("02"),
        RESEND_REQUESTED("03"),
        FAILED_WITH_REASON("04");

        private final String code;

        ErrorCode(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    public WebhookResponse compose(BatchResult result) {
        List<TransactionResult> data = new ArrayList<>(result.getOutcomes().size());
        for (ProcessingOutcome outcome : result.getOutcomes()) {
            data.add(toTransactionResult(outcome));
        }

        boolean success = result.isFullySuccessful();
        return WebhookResponse.builder()
                .batchId(batchIdOrSentinel(result.getBatchId()))
                .code(success ? CODE_BATCH_SUCCESS : CODE_BATCH_PARTIAL_FAILURE)
                .message(success ? "Success" : "Some transactions failed")
                .data(data)
                .build();
    }

    public WebhookResponse reject(String batchId, PipelineRejection rejection) {
        return reject(batchId, rejection, rejection.getDefaultMessage());
    }

    public WebhookResponse reject(String batchId, PipelineRejection rejection, String message) {
        return WebhookResponse.builder()
                .batchId(batchIdOrSentinel(batchId))
                .code(rejection.getCode())
                .message(message)
                .data(new ArrayList<>())
                .build();
    }

    TransactionResult toTransactionResult(ProcessingOutcome outcome) {
        Map<String, Object> info = new LinkedHashMap<>();
        ErrorCode errorCode;

        switch (outcome.getStatus()) {
            case SUCCESS -> errorCode = ErrorCode.SUCCESS;
            case DUPLICATE_REJECTED -> {
                errorCode = ErrorCode.FAILED_NO_DETAIL;
                info.put("reason", "duplicate_transaction");
            }
            case VALIDATION_FAILED -> {
                errorCode = ErrorCode.FAILED_WITH_REASON;
                info.put("validationErrors", outcome.getReasons());
            }
            default -> {
                errorCode = ErrorCode.FAILED_WITH_REASON;
                info.put("errorDetail", outcome.getReasons().get(0));
            }
        }

        return TransactionResult.builder()
                .transactionId(outcome.getTransactionId())
                .errorCode(errorCode.getCode())
                .description(outcome.describe())
                .additionalInfo(info)
                .build();
    }

    private static String batchIdOrSentinel(String batchId) {
        return batchId == null || batchId.isBlank() ? UNKNOWN_BATCH_ID : batchId;
    }
}
