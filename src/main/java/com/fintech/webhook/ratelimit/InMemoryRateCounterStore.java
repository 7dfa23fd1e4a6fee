package com.fintech.webhook.ratelimit;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-local counters, used when no Redis is available.
 *
 * Correct within one instance only. Guarded by a single mutex; windows whose
 * reset time has passed are swept when the map grows past the threshold and
 * on the limiter's schedule.
 */
public class InMemoryRateCounterStore implements RateCounterStore {

    private static final class WindowCounter {
        private long count;
        private final long resetAt;

        private WindowCounter(long resetAt) {
            this.resetAt = resetAt;
        }
    }

    private final Map<String, WindowCounter> counters = new HashMap<>();
    private final Clock clock;
    private final int sweepThreshold;

    public InMemoryRateCounterStore(Clock clock, int sweepThreshold) {
        this.clock = clock;
        this.sweepThreshold = sweepThreshold;
    }

    @Override
    public synchronized long increment(String callerId, long windowStart, long resetAt, int ttlSeconds) {
        if (counters.size() > sweepThreshold) {
            sweepExpiredLocked();
        }
        WindowCounter counter = counters.computeIfAbsent(callerId + ":" + windowStart, k -> new WindowCounter(resetAt));
        counter.count++;
        return counter.count;
    }

    @Override
    public boolean isShared() {
        return false;
    }

    /**
     * @return number of removed windows
     */
    public synchronized int sweepExpired() {
        return sweepExpiredLocked();
    }

    public synchronized int size() {
        return counters.size();
    }

    private int sweepExpiredLocked() {
        long now = clock.instant().getEpochSecond();
        int before = counters.size();
        counters.values().removeIf(counter -> now >= counter.resetAt);
        return before - counters.size();
    }
}
