package com.fintech.webhook.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.net.URI;
import java.time.Duration;

/**
 * Jedis pool for the shared rate-limit counters.
 * <p>
 * Only created when {@code app.redis.enabled=true}; without it the rate limiter
 * counts in process memory.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.redis", name = "enabled", havingValue = "true")
public class RedisConfig {

    @Value("${app.redis.url:redis://localhost:6379}")
    private String redisUrl;

    @Value("${app.redis.timeout-ms:2000}")
    private int timeoutMs;

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool() {
        URI uri = URI.create(redisUrl);

        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(50);
        config.setMaxIdle(10);
        config.setMinIdle(2);
        config.setJmxEnabled(false);
        // Never wait forever for a pooled connection
        config.setMaxWait(Duration.ofMillis(timeoutMs));

        String password = null;
        if (uri.getUserInfo() != null) {
            String[] parts = uri.getUserInfo().split(":", 2);
            password = parts.length == 2 ? parts[1] : parts[0];
        }
        boolean tls = "rediss".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort() == -1 ? 6379 : uri.getPort();

        log.info("Configuring Redis pool host={}, port={}, tls={}, timeoutMs={}", uri.getHost(), port, tls, timeoutMs);

        return new JedisPool(config, uri.getHost(), port, timeoutMs, password, tls);
    }
}
