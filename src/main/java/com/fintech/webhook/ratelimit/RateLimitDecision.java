package com.fintech.webhook.ratelimit;

import lombok.Value;

/**
 * Accounting of one rate-limit check, rendered as X-RateLimit-* headers.
 */
@Value
public class RateLimitDecision {

    boolean allowed;
    long count;
    int limit;
    /** Epoch seconds at which the current window closes. */
    long resetAt;
    int windowSeconds;
    /** True when the counter store failed and the request was let through uncounted. */
    boolean degraded;

    public long getRemaining() {
        return Math.max(0, limit - count);
    }
}
