package com.fintech.webhook.ratelimit;

public class RateCounterStoreException extends RuntimeException {

    public RateCounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
