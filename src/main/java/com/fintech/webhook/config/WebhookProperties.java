package com.fintech.webhook.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code app.webhook} section from application.yml.
 * <p>
 * Everything here is read once at startup. Trusted networks and the public key
 * are only reloaded by restarting the process.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.webhook")
public class WebhookProperties {

    @Valid
    private Network network = new Network();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Signature signature = new Signature();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Dedup dedup = new Dedup();

    @Getter
    @Setter
    public static class Network {
        /** CIDR prefixes or single addresses, IPv4 or IPv6. Malformed entries are skipped. */
        private List<String> trustedNetworks = new ArrayList<>(List.of("127.0.0.1", "::1"));
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Request ceiling per caller within one window. */
        @Min(1)
        private int requests = 60;

        /** Fixed window length in seconds. */
        @Min(1)
        private int windowSeconds = 60;

        /** In-memory store size that triggers an inline sweep of expired windows. */
        private int sweepThreshold = 1000;
    }

    @Getter
    @Setter
    public static class Signature {
        /** PEM file holding the bank public key or its X.509 certificate. */
        private String publicKeyPath = "certs/bank_public.pem";
    }

    @Getter
    @Setter
    public static class Validation {
        private int minTransactionIdLength = 10;

        /** Must not exceed the transaction_id column length (255). */
        @Max(255)
        private int maxTransactionIdLength = 255;

        private int minAccountNumberLength = 8;
    }

    @Getter
    @Setter
    public static class Dedup {
        /** Processed ids younger than this are loaded into memory at startup and kept in the index. */
        @Min(1)
        private int retentionDays = 30;

        /** Reservations older than this are treated as abandoned and released. */
        @Min(1)
        private int reservationLeaseSeconds = 300;
    }
}
