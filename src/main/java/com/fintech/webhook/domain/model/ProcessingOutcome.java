package com.fintech.webhook.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of processing one transaction of a batch.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessingOutcome {

    public enum Status {
        SUCCESS,
        DUPLICATE_REJECTED,
        VALIDATION_FAILED,
        PROCESSING_ERROR
    }

    String transactionId;
    Status status;
    List<String> reasons;

    public static ProcessingOutcome success(String transactionId) {
        return new ProcessingOutcome(transactionId, Status.SUCCESS, List.of());
    }

    public static ProcessingOutcome duplicate(String transactionId) {
        return new ProcessingOutcome(transactionId, Status.DUPLICATE_REJECTED, List.of("Duplicate transaction"));
    }

    public static ProcessingOutcome validationFailed(String transactionId, List<String> violations) {
        return new ProcessingOutcome(transactionId, Status.VALIDATION_FAILED, List.copyOf(violations));
    }

    public static ProcessingOutcome processingError(String transactionId, String reason) {
        return new ProcessingOutcome(transactionId, Status.PROCESSING_ERROR,
                List.of(reason == null ? "Unknown processing error" : reason));
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Human readable description of the outcome.
     */
    public String describe() {
        return switch (status) {
            case SUCCESS -> "Transaction processed successfully";
            case DUPLICATE_REJECTED -> "Duplicate transaction";
            case VALIDATION_FAILED -> "Validation failed: " + String.join(", ", reasons);
            case PROCESSING_ERROR -> "Processing failed: " + reasons.get(0);
        };
    }
}
