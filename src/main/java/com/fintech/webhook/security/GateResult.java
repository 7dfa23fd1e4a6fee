package com.fintech.webhook.security;

import com.fintech.webhook.domain.model.PipelineRejection;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Verdict of a gate: either admitted, or rejected with the reason. Both carry the
 * batch id known at that point (null when the body could not be read).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GateResult {

    boolean admitted;
    PipelineRejection rejection;
    String batchId;
    String message;

    public static GateResult admit(String batchId) {
        return new GateResult(true, null, batchId, null);
    }

    public static GateResult reject(PipelineRejection rejection, String batchId) {
        return new GateResult(false, rejection, batchId, rejection.getDefaultMessage());
    }

    public static GateResult reject(PipelineRejection rejection, String batchId, String message) {
        return new GateResult(false, rejection, batchId, message);
    }
}
