package com.pocketledger.service;

import com.pocketledger.domain.Account;
import com.pocketledger.domain.Category;
import com.pocketledger.domain.Transaction;
import com.pocketledger.exception.AccessDeniedException;
import com.pocketledger.exception.AtomicityFailureException;
import com.pocketledger.exception.InvalidReferenceException;
import com.pocketledger.exception.ResourceNotFoundException;
import com.pocketledger.repository.AccountRepository;
import com.pocketledger.repository.CategoryRepository;
import com.pocketledger.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Balance maintenance engine: the only component that writes
 * {@code Account.currentBalance}.
 *
 * CRITICAL: every public mutation runs as ONE database transaction that
 * 1. validates every referenced account/category against the acting user (no writes yet)
 * 2. writes the transaction row(s)
 * 3. applies each account's delta as a relative UPDATE, in ascending account id order
 *
 * Any exception in steps 1-3 rolls the whole unit back. A delta that touches
 * no row raises {@link AtomicityFailureException}.
 *
 * Concurrency:
 * - concurrent postings to the same account are serialized by the row lock the
 *   relative UPDATE takes; no balance is ever computed in Java and written back
 * - update/delete lock the transaction row first (SELECT ... FOR UPDATE) so a
 *   revert is computed from committed values and applied exactly once
 * - ascending delta order means two units touching the same pair of accounts
 *   always lock them in the same order (no deadlock)
 *
 * Reconstruction reads never use the cache, except reconstructOpeningClosing,
 * which anchors on it and walks backwards.
 */
@Service
@Transactional
public class BalanceEngine {

    private static final Logger log = LoggerFactory.getLogger(BalanceEngine.class);

    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;

    public BalanceEngine(TransactionRepository transactionRepository,
                         AccountRepository accountRepository,
                         CategoryRepository categoryRepository) {
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.categoryRepository = categoryRepository;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // CREATE
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Post a single transaction and its balance delta.
     *
     * @throws InvalidReferenceException if the account or category is not the user's
     */
    public Transaction applyCreate(Long userId, TransactionDraft draft) {
        return applyCreateAll(userId, List.of(draft)).get(0);
    }

    /**
     * Post several transactions as one atomic unit. Used by transfers: either
     * every row and every delta is committed, or nothing is.
     *
     * @return the saved transactions, in draft order
     */
    public List<Transaction> applyCreateAll(Long userId, List<TransactionDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new IllegalArgumentException("At least one transaction is required");
        }

        // Resolve and construct everything before the first write
        List<Transaction> pending = new ArrayList<>(drafts.size());
        for (TransactionDraft draft : drafts) {
            Account account = resolveAccount(userId, draft.accountId());
            Category category = resolveCategory(userId, draft.categoryId());
            pending.add(new Transaction(
                    account.getUser(),
                    account,
                    category,
                    draft.type(),
                    draft.amount(),
                    draft.transactionDate() != null ? draft.transactionDate() : Instant.now(),
                    draft.description()
            ));
        }

        List<Transaction> saved = transactionRepository.saveAll(pending);

        SortedMap<Long, BigDecimal> deltas = new TreeMap<>();
        for (Transaction tx : saved) {
            deltas.merge(tx.getAccount().getId(), tx.signedAmount(), BigDecimal::add);
        }
        applyDeltas(deltas);

        log.info("Posted {} transaction(s) for userId={}: {}", saved.size(), userId, saved);
        return saved;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // UPDATE
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Edit amount, date, description, category and/or account of a transaction.
     * The type never changes, so the reapplied delta always uses the original type.
     *
     * Same account:      one net delta (revert + reapply), skipped when zero
     * Different account: revert on the old account, reapply on the new one
     *
     * @throws ResourceNotFoundException  if no transaction has this id
     * @throws AccessDeniedException      if it belongs to another user
     * @throws InvalidReferenceException  if a newly referenced account/category is not the user's
     */
    public Transaction applyUpdate(Long userId, Long transactionId, TransactionChanges changes) {
        Transaction tx = lockOwned(userId, transactionId);

        Account oldAccount = tx.getAccount();
        Account newAccount = null;
        if (changes.accountId() != null && !changes.accountId().equals(oldAccount.getId())) {
            newAccount = resolveAccount(userId, changes.accountId());
        }
        Category newCategory = null;
        if (changes.categoryId() != null && !changes.categoryId().equals(tx.getCategory().getId())) {
            newCategory = resolveCategory(userId, changes.categoryId());
        }

        BigDecimal revert = tx.signedAmount().negate();
        BigDecimal newAmount = changes.amount() != null ? changes.amount() : tx.getAmount();

        tx.revise(changes.description(), changes.amount(), changes.transactionDate(), newCategory, newAccount);
        BigDecimal reapply = tx.getType().signedAmount(newAmount);
        Transaction saved = transactionRepository.save(tx);

        SortedMap<Long, BigDecimal> deltas = new TreeMap<>();
        deltas.merge(oldAccount.getId(), revert, BigDecimal::add);
        deltas.merge(saved.getAccount().getId(), reapply, BigDecimal::add);
        applyDeltas(deltas);

        log.info("Updated transaction {} for userId={}: revert={} reapply={} accounts={}",
                transactionId, userId, revert, reapply, deltas.keySet());
        return saved;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // DELETE
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Remove a transaction and revert its delta.
     *
     * @return the removed transaction (detached)
     */
    public Transaction applyDelete(Long userId, Long transactionId) {
        Transaction tx = lockOwned(userId, transactionId);
        BigDecimal revert = tx.signedAmount().negate();
        Long accountId = tx.getAccount().getId();

        transactionRepository.delete(tx);

        SortedMap<Long, BigDecimal> deltas = new TreeMap<>();
        deltas.put(accountId, revert);
        applyDeltas(deltas);

        log.info("Deleted transaction {} for userId={}, revert={} on accountId={}",
                transactionId, userId, revert, accountId);
        return tx;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // RECONSTRUCTION (cache-independent reads)
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * initialBalance + signed sum of the account's transactions, optionally
     * restricted to a date range. Without a range this must equal the cached
     * balance whenever no mutation is in flight.
     */
    @Transactional(readOnly = true)
    public BigDecimal reconstructBalance(Account account, DateRange range) {
        List<TransactionRepository.TypeTotal> totals = range == null
                ? transactionRepository.sumByType(account.getId())
                : transactionRepository.sumByTypeBetween(account.getId(), range.start(), range.end());
        return account.getInitialBalance().add(net(totals));
    }

    /**
     * closing = cached - net(after end); opening = closing - net(within range).
     * When nothing was posted after the range end, closing equals the cached balance.
     *
     * The cached anchor and both sums are read in one REPEATABLE_READ snapshot, so a
     * posting committed meanwhile is either in all three reads or in none.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PeriodBalance reconstructOpeningClosing(Account account, DateRange range) {
        if (range == null) {
            throw new IllegalArgumentException("A date range is required");
        }
        BigDecimal cached = accountRepository.findCurrentBalance(account.getId())
                .orElseThrow(() -> ResourceNotFoundException.of("Account", account.getId()));
        BigDecimal netAfter = net(transactionRepository.sumByTypeAfter(account.getId(), range.end()));
        BigDecimal netWithin = net(transactionRepository.sumByTypeBetween(
                account.getId(), range.start(), range.end()));

        BigDecimal closing = cached.subtract(netAfter);
        BigDecimal opening = closing.subtract(netWithin);
        return new PeriodBalance(opening, closing, netWithin);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // HELPERS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Fold raw per-type totals into one signed net using the type's sign.
     */
    static BigDecimal net(List<TransactionRepository.TypeTotal> totals) {
        BigDecimal net = BigDecimal.ZERO;
        for (TransactionRepository.TypeTotal total : totals) {
            if (total.getTotal() != null) {
                net = net.add(total.getType().signedAmount(total.getTotal()));
            }
        }
        return net;
    }

    private void applyDeltas(SortedMap<Long, BigDecimal> deltas) {
        Instant now = Instant.now();
        for (Map.Entry<Long, BigDecimal> delta : deltas.entrySet()) {
            if (delta.getValue().signum() == 0) {
                continue;
            }
            int rows = accountRepository.applyBalanceDelta(delta.getKey(), delta.getValue(), now);
            if (rows != 1) {
                throw new AtomicityFailureException(String.format(
                        "Balance update touched %d rows for accountId=%d", rows, delta.getKey()));
            }
            log.debug("Applied delta {} to accountId={}", delta.getValue(), delta.getKey());
        }
    }

    private Transaction lockOwned(Long userId, Long transactionId) {
        Transaction tx = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Transaction", transactionId));
        if (!tx.isOwnedBy(userId)) {
            throw new AccessDeniedException(
                    "You do not have permission to modify transaction: " + transactionId);
        }
        return tx;
    }

    private Account resolveAccount(Long userId, Long accountId) {
        if (accountId == null) {
            throw new InvalidReferenceException("Account is required");
        }
        return accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> InvalidReferenceException.account(accountId));
    }

    private Category resolveCategory(Long userId, Long categoryId) {
        if (categoryId == null) {
            throw new InvalidReferenceException("Category is required");
        }
        return categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> InvalidReferenceException.category(categoryId));
    }
}
