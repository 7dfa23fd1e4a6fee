package com.fintech.webhook.ratelimit;

import com.fintech.webhook.config.WebhookProperties;
import com.fintech.webhook.domain.model.SharedDependency;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPool;

import java.time.Clock;

/**
 * Fixed-window rate limiter per caller identity.
 *
 * windowStart = floor(now / window) * window, one counter per (caller, windowStart).
 * Redis counters are used when a pool is configured and answers at startup;
 * otherwise counting happens in process memory.
 */
@Slf4j
@Component
public class RateLimiter {

    private final RateCounterStore store;
    private final WebhookProperties.RateLimit settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public RateLimiter(ObjectProvider<JedisPool> jedisPool,
                       WebhookProperties properties,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this(selectStore(jedisPool.getIfAvailable(), properties.getRateLimit(), clock),
                properties, clock, meterRegistry);
    }

    RateLimiter(RateCounterStore store, WebhookProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.settings = properties.getRateLimit();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        log.info("Rate limiter ready: {} requests per {}s, store={}",
                settings.getRequests(), settings.getWindowSeconds(), store.isShared() ? "redis" : "memory");
    }

    private static RateCounterStore selectStore(JedisPool pool, WebhookProperties.RateLimit settings, Clock clock) {
        if (pool != null) {
            RedisRateCounterStore redisStore = new RedisRateCounterStore(pool);
            if (redisStore.ping()) {
                return redisStore;
            }
            log.error("Redis did not answer at startup, counting rate limits in memory");
        }
        return new InMemoryRateCounterStore(clock, settings.getSweepThreshold());
    }

    public RateLimitDecision check(String callerId) {
        int window = settings.getWindowSeconds();
        int limit = settings.getRequests();
        long now = clock.instant().getEpochSecond();
        long windowStart = now / window * window;
        long resetAt = windowStart + window;

        long count;
        try {
            count = store.increment(callerId, windowStart, resetAt, window * 2);
        } catch (RateCounterStoreException e) {
            if (!SharedDependency.RATE_COUNTER_STORE.failsOpen()) {
                throw e;
            }
            log.warn("Rate counter store unavailable, allowing request from {}: {}", callerId, e.getMessage());
            Counter.builder("ratelimit.store.degraded")
                    .register(meterRegistry)
                    .increment();
            return new RateLimitDecision(true, 0, limit, resetAt, window, true);
        }

        boolean allowed = count <= limit;
        if (log.isDebugEnabled()) {
            log.debug("Rate limit check caller={} count={} limit={} allowed={} resetAt={}",
                    callerId, count, limit, allowed, resetAt);
        }
        return new RateLimitDecision(allowed, count, limit, resetAt, window, false);
    }

    @Scheduled(fixedDelayString = "${app.webhook.rate-limit.sweep-interval-ms:60000}")
    public void sweepLocalCounters() {
        if (store instanceof InMemoryRateCounterStore memoryStore) {
            int removed = memoryStore.sweepExpired();
            if (removed > 0) {
                log.debug("Swept {} expired in-memory rate windows", removed);
            }
        }
    }
}
