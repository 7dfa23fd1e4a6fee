package com.fintech.webhook.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Downstream notification emitted through the outbox once a bank transaction
 * has been applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionAppliedEvent {

    private String transactionId;
    private String transactionRefNo;
    private String batchId;
    private String accountNumber;
    private BigDecimal amount;
    private BigDecimal availableBalance;
    private TransactionType type;
    private String description;
    private String counterpartyAccountNumber;
    private String counterpartyAccountName;
    private String counterpartyBankId;
    private Instant appliedAt;
}
