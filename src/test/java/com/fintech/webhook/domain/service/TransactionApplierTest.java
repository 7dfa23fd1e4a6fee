package com.fintech.webhook.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.webhook.domain.model.TransactionAppliedEvent;
import com.fintech.webhook.domain.model.TransactionRecord;
import com.fintech.webhook.domain.model.TransactionType;
import com.fintech.webhook.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.webhook.infrastructure.persistence.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransactionApplierTest {

    @Mock private OutboxEventRepository outboxEventRepository;
    @Mock private DedupIndex dedupIndex;

    private ObjectMapper objectMapper;
    private TransactionApplier applier;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);
        applier = new TransactionApplier(outboxEventRepository, dedupIndex, objectMapper, clock);
    }

    @Test
    void apply_writesOutboxEventAndMarksProcessed() throws Exception {
        TransactionRecord record = TransactionRecord.builder()
                .transactionId("TXN-0000000001")
                .transactionRefNo("REF-1")
                .sourceAccountNumber("1234567890")
                .amount(new BigDecimal("250000"))
                .transactionTypeCode("D")
                .transDesc("Payment")
                .build();

        TransactionAppliedEvent event = applier.apply(record, "BATCH-1");

        assertEquals(TransactionType.DEBIT, event.getType());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), event.getAppliedAt());

        ArgumentCaptor<OutboxEventEntity> captor = ArgumentCaptor.forClass(OutboxEventEntity.class);
        verify(outboxEventRepository).save(captor.capture());
        OutboxEventEntity saved = captor.getValue();
        assertEquals("TRANSACTION_DEBITED", saved.getEventType());
        assertEquals("TXN-0000000001", saved.getTransactionId());
        assertEquals("BATCH-1", saved.getBatchId());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals("1234567890", payload.get("accountNumber").asText());
        assertEquals("Payment", payload.get("description").asText());

        verify(dedupIndex).markProcessed("TXN-0000000001");
    }

    @Test
    void apply_unknownType_throwsBeforeWriting() {
        TransactionRecord record = TransactionRecord.builder()
                .transactionId("TXN-0000000001")
                .transactionTypeCode("Z")
                .build();

        assertThrows(IllegalArgumentException.class, () -> applier.apply(record, "BATCH-1"));
        verify(outboxEventRepository, never()).save(any());
        verify(dedupIndex, never()).markProcessed(anyString());
    }
}
