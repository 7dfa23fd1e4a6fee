package com.fintech.webhook.ratelimit;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Response;
import redis.clients.jedis.Transaction;

/**
 * Counters shared by every gateway instance through Redis.
 *
 * INCR and EXPIRE run in one MULTI/EXEC block; the TTL is refreshed on every
 * hit so a counter lives two windows after its last increment at most.
 */
@Slf4j
public class RedisRateCounterStore implements RateCounterStore {

    private static final String KEY_PREFIX = "RateLimit:";

    private final JedisPool pool;

    public RedisRateCounterStore(JedisPool pool) {
        this.pool = pool;
    }

    static String key(String callerId, long windowStart) {
        return KEY_PREFIX + callerId + ":" + windowStart;
    }

    @Override
    public long increment(String callerId, long windowStart, long resetAt, int ttlSeconds) {
        String key = key(callerId, windowStart);
        try (Jedis redis = pool.getResource()) {
            Transaction tx = redis.multi();
            Response<Long> count = tx.incr(key);
            tx.expire(key, ttlSeconds);
            tx.exec();
            return count.get();
        } catch (RuntimeException e) {
            throw new RateCounterStoreException("Redis counter update failed for " + key, e);
        }
    }

    @Override
    public boolean isShared() {
        return true;
    }

    /**
     * @return true if Redis answers a PING
     */
    public boolean ping() {
        try (Jedis redis = pool.getResource()) {
            return "PONG".equalsIgnoreCase(redis.ping());
        } catch (RuntimeException e) {
            log.warn("Redis PING failed: {}", e.getMessage());
            return false;
        }
    }
}
