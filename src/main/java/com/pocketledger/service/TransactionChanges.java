package com.pocketledger.service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial edit of a transaction. Null components are left unchanged.
 * There is no type component: a transaction's type cannot be edited.
 */
public record TransactionChanges(
        String description,
        BigDecimal amount,
        Instant transactionDate,
        Long accountId,
        Long categoryId) {
}
