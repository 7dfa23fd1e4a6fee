package com.fintech.webhook.domain.service;

import com.fintech.webhook.config.WebhookProperties;
import com.fintech.webhook.domain.model.TransactionRecord;
import com.fintech.webhook.domain.model.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Field rules every transaction must satisfy before it is applied.
 * Returns every violated rule, not just the first one.
 */
@Component
@RequiredArgsConstructor
public class TransactionValidator {

    private static final String VALID_TYPE_CODES = Arrays.stream(TransactionType.values())
            .map(TransactionType::getCode)
            .collect(Collectors.joining(", "));

    private final WebhookProperties properties;

    public List<String> validate(TransactionRecord record) {
        WebhookProperties.Validation rules = properties.getValidation();
        List<String> errors = new ArrayList<>();

        String transactionId = record.getTransactionId();
        if (transactionId == null || transactionId.isBlank()
                || transactionId.length() < rules.getMinTransactionIdLength()
                || transactionId.length() > rules.getMaxTransactionIdLength()) {
            errors.add("Invalid transaction ID format");
        }

        if (record.getAmount() == null || record.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            errors.add("Transaction amount must be positive");
        }

        String account = record.getSourceAccountNumber();
        if (account == null || account.isBlank() || account.length() < rules.getMinAccountNumberLength()) {
            errors.add("Invalid account number format");
        }

        if (record.getTransactionType().isEmpty()) {
            errors.add("Invalid transaction type. Must be one of: " + VALID_TYPE_CODES);
        }

        if (record.getAvailableBalance() != null && record.getAvailableBalance().signum() < 0) {
            errors.add("Available balance must not be negative");
        }

        return errors;
    }
}
