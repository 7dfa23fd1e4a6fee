package com.fintech.webhook.security;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds the bytes the bank signs. Scheme v1 concatenates sourceAppId, batchId and
 * timestamp in that order with no separator, encoded as UTF-8.
 * Changing the field list requires a new version.
 */
public final class SignatureCanonicalizer {

    public static final String VERSION = "v1";

    public static final List<String> FIELDS = List.of("sourceAppId", "batchId", "timestamp");

    private SignatureCanonicalizer() {
    }

    public static byte[] canonicalize(String sourceAppId, String batchId, String timestamp) {
        return (sourceAppId + batchId + timestamp).getBytes(StandardCharsets.UTF_8);
    }
}
