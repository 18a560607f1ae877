package com.pocketledger.service;

import com.pocketledger.domain.Transaction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Everything needed to post a new transaction on behalf of a user.
 */
public record TransactionDraft(
        String description,
        BigDecimal amount,
        Transaction.TransactionType type,
        Instant transactionDate,
        Long accountId,
        Long categoryId) {
}
