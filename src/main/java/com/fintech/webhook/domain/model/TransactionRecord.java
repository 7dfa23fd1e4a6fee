package com.fintech.webhook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A single transaction inside a notification batch.
 *
 * transactionId is the idempotency key. Every descriptive field is optional
 * and stays null when the bank omits it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionRecord {

    private String transactionId;

    @JsonProperty("tranRefNo")
    private String transactionRefNo;

    @JsonProperty("srcAccountNumber")
    private String sourceAccountNumber;

    private BigDecimal amount;

    @JsonProperty("balanceAvailable")
    private BigDecimal availableBalance;

    /** Raw type code as sent by the bank: "C" or "D". */
    @JsonProperty("transType")
    private String transactionTypeCode;

    // Descriptive fields
    private String noticeCreatedTime;
    private String transTime;
    private String transDesc;
    private String ofsAccountNumber;
    private String ofsAccountName;
    private String ofsBankId;
    private String ofsBankName;
    private String currency;

    @JsonIgnore
    public Optional<TransactionType> getTransactionType() {
        return TransactionType.fromCode(transactionTypeCode);
    }
}
