package com.fintech.webhook.domain.model;

/**
 * Failure policy table for the externally shared stores.
 *
 * Components never decide fail-open or fail-closed on their own; they ask this
 * table what to do when their store misbehaves.
 *
 * - RATE_COUNTER_STORE: FAIL_OPEN. A Redis outage lets the request through.
 * - DEDUP_STORE: FAIL_CLOSED. An outage rejects the transaction as unprocessed.
 */
public enum SharedDependency {

    RATE_COUNTER_STORE(FailurePolicy.FAIL_OPEN),
    DEDUP_STORE(FailurePolicy.FAIL_CLOSED);

    public enum FailurePolicy {
        FAIL_OPEN,
        FAIL_CLOSED
    }

    private final FailurePolicy policy;

    SharedDependency(FailurePolicy policy) {
        this.policy = policy;
    }

    public FailurePolicy getPolicy() {
        return policy;
    }

    public boolean failsOpen() {
        return policy == FailurePolicy.FAIL_OPEN;
    }
}
