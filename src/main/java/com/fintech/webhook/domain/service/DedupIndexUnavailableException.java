package com.fintech.webhook.domain.service;

/**
 * The duplicate index could not answer. Callers fail closed.
 */
public class DedupIndexUnavailableException extends RuntimeException {

    public DedupIndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
