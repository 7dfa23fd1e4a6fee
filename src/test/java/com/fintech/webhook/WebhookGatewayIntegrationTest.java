package com.fintech.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.webhook.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.webhook.infrastructure.persistence.repository.OutboxEventRepository;
import com.fintech.webhook.support.TestKeys;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WebhookGatewayIntegrationTest {

    private static final String ENDPOINT = "/webhook/bank-notification";
    private static final String TIMESTAMP = "2024-01-01T10:00:00";

    @DynamicPropertySource
    static void bankKey(DynamicPropertyRegistry registry) {
        String path = TestKeys.writePublicKeyPem(TestKeys.BANK_KEYS).toString();
        registry.add("app.webhook.signature.public-key-path", () -> path);
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private OutboxEventRepository outboxEventRepository;
    @Autowired private MeterRegistry meterRegistry;

    @Test
    void validBatch_isApplied() throws Exception {
        String batchId = newId("BATCH");
        String txnId = newId("TXN");

        mockMvc.perform(webhook(signedBatch(batchId, transaction(txnId, "C"))))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Limit", "1000"))
                .andExpect(header().exists("X-RateLimit-Remaining"))
                .andExpect(header().exists("X-RateLimit-Reset"))
                .andExpect(header().string("X-RateLimit-Window", "60"))
                .andExpect(jsonPath("$.batchId").value(batchId))
                .andExpect(jsonPath("$.code").value("200"))
                .andExpect(jsonPath("$.message").value("Success"))
                .andExpect(jsonPath("$.data[0].transactionId").value(txnId))
                .andExpect(jsonPath("$.data[0].errorCode").value("01"));

        List<OutboxEventEntity> events = outboxEventRepository.findByTransactionId(txnId);
        assertEquals(1, events.size());
        assertEquals("TRANSACTION_CREDITED", events.get(0).getEventType());
        assertEquals(batchId, events.get(0).getBatchId());
    }

    @Test
    void resubmittedTransaction_isRejectedAsDuplicate() throws Exception {
        String txnId = newId("TXN");

        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(txnId, "D"))))
                .andExpect(jsonPath("$.data[0].errorCode").value("01"));

        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(txnId, "D"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Some transactions failed"))
                .andExpect(jsonPath("$.data[0].errorCode").value("02"))
                .andExpect(jsonPath("$.data[0].additionalInfo.reason").value("duplicate_transaction"));
    }

    @Test
    void partialFailure_reportsEachTransaction() throws Exception {
        String good = newId("TXN");
        String bad = newId("TXN");
        Map<String, Object> invalid = transaction(bad, "X");
        invalid.put("amount", -10);

        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(good, "C"), invalid)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].transactionId").value(good))
                .andExpect(jsonPath("$.data[0].errorCode").value("01"))
                .andExpect(jsonPath("$.data[1].transactionId").value(bad))
                .andExpect(jsonPath("$.data[1].errorCode").value("04"))
                .andExpect(jsonPath("$.data[1].additionalInfo.validationErrors",
                        hasItems("Transaction amount must be positive",
                                "Invalid transaction type. Must be one of: C, D")));
    }

    @Test
    void overlongTransactionId_failsValidationNotDuplicateCheck() throws Exception {
        String txnId = "TXN-" + "5".repeat(300);

        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(txnId, "C"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.data[0].errorCode").value("04"))
                .andExpect(jsonPath("$.data[0].additionalInfo.validationErrors",
                        hasItem("Invalid transaction ID format")));
    }

    @Test
    void longBatchId_isAccepted() throws Exception {
        String batchId = "BATCH-" + "6".repeat(300);

        mockMvc.perform(webhook(signedBatch(batchId, transaction(newId("TXN"), "C"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value(batchId))
                .andExpect(jsonPath("$.code").value("200"))
                .andExpect(jsonPath("$.data[0].errorCode").value("01"));
    }

    @Test
    void nullEntry_isReportedWithoutLosingTheRestOfTheBatch() throws Exception {
        String txnId = newId("TXN");
        Map<String, Object> batch = signedBatch(newId("BATCH"));
        batch.put("data", Arrays.asList(transaction(txnId, "C"), null));

        mockMvc.perform(webhook(batch))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].transactionId").value(txnId))
                .andExpect(jsonPath("$.data[0].errorCode").value("01"))
                .andExpect(jsonPath("$.data[1].transactionId").value(nullValue()))
                .andExpect(jsonPath("$.data[1].errorCode").value("04"));
    }

    @Test
    void nonPostMethod_isMalformedEnvelope() throws Exception {
        String body = objectMapper.writeValueAsString(signedBatch(newId("BATCH"), transaction(newId("TXN"), "C")));

        mockMvc.perform(put(ENDPOINT).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Unsupported method PUT"));
    }

    @Test
    void nonJsonContentType_isMalformedEnvelope() throws Exception {
        String body = objectMapper.writeValueAsString(signedBatch(newId("BATCH"), transaction(newId("TXN"), "C")));

        mockMvc.perform(post(ENDPOINT).contentType(MediaType.TEXT_PLAIN).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Unsupported content type text/plain"));
    }

    @Test
    void unmappableField_keepsVerifiedBatchId() throws Exception {
        Map<String, Object> invalid = transaction(newId("TXN"), "C");
        invalid.put("amount", "abc");

        mockMvc.perform(webhook(signedBatch("BATCH-KNOWN", invalid)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value("BATCH-KNOWN"))
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    @Test
    void emptyBody_isMalformed() throws Exception {
        mockMvc.perform(post(ENDPOINT).contentType(MediaType.APPLICATION_JSON).content(""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value("unknown"))
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.data", hasSize(0)));
    }

    @Test
    void missingSignature_isUnauthorized() throws Exception {
        Map<String, Object> batch = signedBatch("BATCH-NOSIG", transaction(newId("TXN"), "C"));
        batch.remove("signature");

        mockMvc.perform(webhook(batch))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value("BATCH-NOSIG"))
                .andExpect(jsonPath("$.code").value("401"))
                .andExpect(jsonPath("$.message").value("Missing signature"));
    }

    @Test
    void tamperedBatch_isUnauthorized() throws Exception {
        Map<String, Object> batch = signedBatch(newId("BATCH"), transaction(newId("TXN"), "C"));
        batch.put("timestamp", "2024-01-01T10:00:01");

        mockMvc.perform(webhook(batch))
                .andExpect(jsonPath("$.code").value("401"))
                .andExpect(jsonPath("$.message").value("Signature is not valid"));
    }

    @Test
    void emptyData_isRejected() throws Exception {
        mockMvc.perform(webhook(signedBatch("BATCH-EMPTY")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value("BATCH-EMPTY"))
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("No transactions in batch"));
    }

    @Test
    void unmappableData_isMalformed() throws Exception {
        Map<String, Object> batch = signedBatch(newId("BATCH"));
        batch.put("data", "not-a-list");

        mockMvc.perform(webhook(batch))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    @Test
    void untrustedCaller_isForbidden() throws Exception {
        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(newId("TXN"), "C")))
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.9");
                            return request;
                        }))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-RateLimit-Limit"))
                .andExpect(jsonPath("$.code").value("403"))
                .andExpect(jsonPath("$.data", hasSize(0)));

        assertNotNull(meterRegistry.find("webhook.gate.rejected")
                .tag("reason", "UNTRUSTED_NETWORK")
                .tag("stage", "admission")
                .counter());
    }

    @Test
    void forwardedCallerInsideTrustedNetwork_isAdmitted() throws Exception {
        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(newId("TXN"), "C")))
                        .header("X-Forwarded-For", "10.20.30.40, 203.0.113.9")
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.9");
                            return request;
                        }))
                .andExpect(jsonPath("$.code").value("200"));
    }

    @Test
    void health_bypassesGates() throws Exception {
        mockMvc.perform(get("/health").with(request -> {
                    request.setRemoteAddr("203.0.113.9");
                    return request;
                }))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-RateLimit-Limit"))
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").exists());
    }

    @Test
    void adminStats_reflectProcessedTransactions() throws Exception {
        mockMvc.perform(webhook(signedBatch(newId("BATCH"), transaction(newId("TXN"), "C"))))
                .andExpect(jsonPath("$.code").value("200"));

        mockMvc.perform(get("/admin/processed-transactions/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalProcessed", greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.pendingReservations").value(0))
                .andExpect(jsonPath("$.retentionDays").value(30));
    }

    @Test
    void adminCleanup_validatesRetention() throws Exception {
        mockMvc.perform(post("/admin/processed-transactions/cleanup").param("daysToKeep", "0"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/admin/processed-transactions/cleanup").param("daysToKeep", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(0))
                .andExpect(jsonPath("$.stats.retentionDays").value(30));
    }

    @Test
    void adminEndpoints_areNetworkFiltered() throws Exception {
        mockMvc.perform(get("/admin/processed-transactions/stats").with(request -> {
                    request.setRemoteAddr("203.0.113.9");
                    return request;
                }))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("403"));
    }

    private MockHttpServletRequestBuilder webhook(Map<String, Object> batch) throws Exception {
        return post(ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(batch));
    }

    @SafeVarargs
    private static Map<String, Object> signedBatch(String batchId, Map<String, Object>... transactions) {
        Map<String, Object> batch = new LinkedHashMap<>();
        batch.put("sourceAppId", "BANKAPP");
        batch.put("batchId", batchId);
        batch.put("timestamp", TIMESTAMP);
        batch.put("signature", TestKeys.sign(TestKeys.BANK_KEYS, "BANKAPP", batchId, TIMESTAMP));
        batch.put("data", List.of(transactions));
        return batch;
    }

    private static Map<String, Object> transaction(String transactionId, String type) {
        Map<String, Object> txn = new LinkedHashMap<>();
        txn.put("transactionId", transactionId);
        txn.put("tranRefNo", "REF-" + transactionId);
        txn.put("srcAccountNumber", "1234567890");
        txn.put("amount", 150000);
        txn.put("balanceAvailable", 2500000);
        txn.put("transType", type);
        txn.put("transDesc", "Integration transfer");
        txn.put("currency", "VND");
        return txn;
    }

    private static String newId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
