package com.fintech.webhook.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.webhook.domain.model.PipelineRejection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Parses the raw body just far enough to verify the batch signature.
 * <p>
 * Checks run in a fixed order and the first failure wins: empty body, malformed JSON,
 * missing signature, missing key, canonical fields, signature match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignatureGate {

    private final ObjectMapper objectMapper;
    private final SignatureVerifier signatureVerifier;

    public GateResult evaluate(byte[] body) {
        if (body == null || isBlank(body)) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null, "Empty request body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Unparseable webhook body: {}", e.getMessage());
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null, "Invalid JSON body");
        }
        if (root == null || !root.isObject()) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null, "Request body must be a JSON object");
        }

        String batchId = textOrNull(root, "batchId");

        String signature = textOrNull(root, "signature");
        if (signature == null || signature.isBlank()) {
            return GateResult.reject(PipelineRejection.MISSING_SIGNATURE, batchId);
        }

        if (!signatureVerifier.hasTrustedKey()) {
            return GateResult.reject(PipelineRejection.MISSING_KEY, batchId);
        }

        for (String field : SignatureCanonicalizer.FIELDS) {
            JsonNode value = root.get(field);
            if (value == null || !value.isTextual()) {
                return GateResult.reject(PipelineRejection.MALFORMED_BODY, batchId,
                        "Missing or invalid field: " + field);
            }
        }

        boolean valid = signatureVerifier.verify(
                root.get("sourceAppId").textValue(),
                root.get("batchId").textValue(),
                root.get("timestamp").textValue(),
                signature);

        return valid ? GateResult.admit(batchId) : GateResult.reject(PipelineRejection.CRYPTO_MISMATCH, batchId);
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.textValue() : null;
    }

    private static boolean isBlank(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }
}
