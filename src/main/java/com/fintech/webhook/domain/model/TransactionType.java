package com.fintech.webhook.domain.model;

import java.util.Optional;

public enum TransactionType {

    CREDIT("C", "TRANSACTION_CREDITED"),
    DEBIT("D", "TRANSACTION_DEBITED");

    private final String code;
    private final String eventType;

    TransactionType(String code, String eventType) {
        this.code = code;
        this.eventType = eventType;
    }

    public String getCode() {
        return code;
    }

    /**
     * Outbox event type written when a transaction of this type is applied.
     */
    public String getEventType() {
        return eventType;
    }

    public static Optional<TransactionType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (TransactionType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
