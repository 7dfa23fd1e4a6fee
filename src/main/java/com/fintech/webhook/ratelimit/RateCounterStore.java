package com.fintech.webhook.ratelimit;

/**
 * Fixed-window request counters keyed by (caller, window start).
 */
public interface RateCounterStore {

    /**
     * Increments the counter of the given window and returns the new value.
     *
     * @param windowStart epoch seconds of the window start
     * @param resetAt     epoch seconds at which the window closes
     * @param ttlSeconds  how long the counter must stay readable
     * @throws RateCounterStoreException when the store cannot be reached
     */
    long increment(String callerId, long windowStart, long resetAt, int ttlSeconds);

    /**
     * @return true when counters are shared between gateway instances
     */
    boolean isShared();
}
