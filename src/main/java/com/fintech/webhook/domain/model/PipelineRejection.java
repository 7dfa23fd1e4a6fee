package com.fintech.webhook.domain.model;

/**
 * Every way the pipeline can stop a request before it reaches the batch processor.
 * Each member maps to the in-band code carried by the response envelope.
 */
public enum PipelineRejection {

    RATE_LIMITED(Stage.ADMISSION, "429", "Rate limit exceeded"),
    UNTRUSTED_NETWORK(Stage.ADMISSION, "403", "IP address is not allowed"),

    MISSING_KEY(Stage.SIGNATURE, "401", "Signature verification key is not available"),
    MISSING_SIGNATURE(Stage.SIGNATURE, "401", "Missing signature"),
    MALFORMED_BODY(Stage.SIGNATURE, "400", "Invalid request body"),
    CRYPTO_MISMATCH(Stage.SIGNATURE, "401", "Signature is not valid"),

    INTERNAL_FAULT(Stage.INTERNAL, "500", "Internal server error");

    public enum Stage {
        ADMISSION,
        SIGNATURE,
        INTERNAL
    }

    private final Stage stage;
    private final String code;
    private final String defaultMessage;

    PipelineRejection(Stage stage, String code, String defaultMessage) {
        this.stage = stage;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public Stage getStage() {
        return stage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
