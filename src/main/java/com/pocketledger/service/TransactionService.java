package com.pocketledger.service;

import com.pocketledger.domain.Transaction;
import com.pocketledger.exception.AccessDeniedException;
import com.pocketledger.exception.AtomicityFailureException;
import com.pocketledger.exception.InvalidReferenceException;
import com.pocketledger.exception.ReceiptStorageException;
import com.pocketledger.exception.ResourceNotFoundException;
import com.pocketledger.receipt.ReceiptStorage;
import com.pocketledger.receipt.StoredReceipt;
import com.pocketledger.repository.AccountRepository;
import com.pocketledger.repository.CategoryRepository;
import com.pocketledger.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Supplier;

/**
 * User-facing transaction operations.
 *
 * CRITICAL: mutations are NOT wrapped in a transaction here. Each one is a
 * single call into {@link BalanceEngine}, whose own transaction is the atomic
 * unit; commit failures therefore surface at that call and are reported as
 * {@link AtomicityFailureException}, with nothing committed.
 *
 * Ownership:
 * - referenced account/category not the caller's → InvalidReference (400)
 * - target transaction missing → NotFound (404); someone else's → AccessDenied (403)
 *
 * Receipts live outside the ledger store and are never part of the atomic unit.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final BalanceEngine balanceEngine;
    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final ReceiptStorage receiptStorage;

    public TransactionService(BalanceEngine balanceEngine,
                              TransactionRepository transactionRepository,
                              AccountRepository accountRepository,
                              CategoryRepository categoryRepository,
                              ReceiptStorage receiptStorage) {
        this.balanceEngine = balanceEngine;
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.categoryRepository = categoryRepository;
        this.receiptStorage = receiptStorage;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    public Transaction create(Long userId, TransactionDraft draft) {
        requireOwnedAccount(userId, draft.accountId());
        requireOwnedCategory(userId, draft.categoryId());

        Transaction tx = atomically("create", () -> balanceEngine.applyCreate(userId, draft));
        log.info("Transaction created - userId={}, transactionId={}, type={}, amount={}, accountId={}",
                userId, tx.getId(), tx.getType(), tx.getAmount(), draft.accountId());
        return tx;
    }

    public Transaction update(Long userId, Long transactionId, TransactionChanges changes) {
        get(userId, transactionId);
        if (changes.accountId() != null) {
            requireOwnedAccount(userId, changes.accountId());
        }
        if (changes.categoryId() != null) {
            requireOwnedCategory(userId, changes.categoryId());
        }
        return atomically("update", () -> balanceEngine.applyUpdate(userId, transactionId, changes));
    }

    /**
     * Delete the transaction, then release its receipt on a best-effort basis:
     * a storage failure is logged and the deletion still stands.
     */
    public void delete(Long userId, Long transactionId) {
        get(userId, transactionId);
        atomically("delete", () -> balanceEngine.applyDelete(userId, transactionId));

        String key = ReceiptStorage.keyFor(userId, transactionId);
        try {
            receiptStorage.delete(key);
        } catch (ReceiptStorageException e) {
            log.warn("Transaction {} deleted but receipt {} could not be released: {}",
                    transactionId, key, e.getMessage());
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * @throws ResourceNotFoundException if no transaction has this id
     * @throws AccessDeniedException     if it belongs to another user
     */
    @Transactional(readOnly = true)
    public Transaction get(Long userId, Long transactionId) {
        Transaction tx = transactionRepository.findById(transactionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Transaction", transactionId));
        if (!tx.isOwnedBy(userId)) {
            throw new AccessDeniedException("You do not have permission to access transaction: " + transactionId);
        }
        return tx;
    }

    /**
     * Newest first by transaction date. Both filters are optional.
     */
    @Transactional(readOnly = true)
    public List<Transaction> list(Long userId, Long accountId, DateRange range) {
        DateRange window = range != null ? range : DateRange.unbounded();
        if (accountId == null) {
            return transactionRepository.findByUserIdAndTransactionDateBetweenOrderByTransactionDateDescIdDesc(
                    userId, window.start(), window.end());
        }
        requireOwnedAccount(userId, accountId);
        return transactionRepository.findByUserIdAndAccountIdAndTransactionDateBetweenOrderByTransactionDateDescIdDesc(
                userId, accountId, window.start(), window.end());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // RECEIPTS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * @return the storage key
     */
    public String attachReceipt(Long userId, Long transactionId, String contentType, byte[] content) {
        get(userId, transactionId);
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Receipt file is empty");
        }
        String key = ReceiptStorage.keyFor(userId, transactionId);
        receiptStorage.store(key, contentType, content);
        return key;
    }

    public StoredReceipt loadReceipt(Long userId, Long transactionId) {
        get(userId, transactionId);
        return receiptStorage.load(ReceiptStorage.keyFor(userId, transactionId))
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No receipt stored for transaction: " + transactionId));
    }

    public void removeReceipt(Long userId, Long transactionId) {
        get(userId, transactionId);
        receiptStorage.delete(ReceiptStorage.keyFor(userId, transactionId));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // HELPERS
    // ─────────────────────────────────────────────────────────────────────────

    private <T> T atomically(String operation, Supplier<T> unit) {
        try {
            return unit.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Transaction {} aborted by the store, nothing was committed", operation, e);
            throw new AtomicityFailureException("Transaction " + operation + " failed and was rolled back", e);
        }
    }

    private void requireOwnedAccount(Long userId, Long accountId) {
        if (accountId == null || !accountRepository.existsByIdAndUserId(accountId, userId)) {
            throw InvalidReferenceException.account(accountId);
        }
    }

    private void requireOwnedCategory(Long userId, Long categoryId) {
        if (categoryId == null || !categoryRepository.existsByIdAndUserId(categoryId, userId)) {
            throw InvalidReferenceException.category(categoryId);
        }
    }
}
