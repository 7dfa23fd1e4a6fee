package com.fintech.webhook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Bank Webhook Gateway
 *
 * Receives signed batches of transaction notifications pushed by the bank
 * and applies every transaction exactly once.
 *
 * Pipeline:
 * - Rate limiter (Redis fixed window, in-memory fallback)
 * - Trusted network filter
 * - SHA512withRSA signature verification
 * - Batch processor with persistent duplicate index
 * - Transactional outbox for applied transactions
 *
 * Every outcome is reported in-band: the webhook endpoint always answers
 * HTTP 200 and carries its status code inside the response envelope.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
@EnableScheduling
public class WebhookGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookGatewayApplication.class, args);
    }
}
