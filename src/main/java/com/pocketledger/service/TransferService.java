package com.pocketledger.service;

import com.pocketledger.domain.Account;
import com.pocketledger.domain.Category;
import com.pocketledger.domain.Transaction;
import com.pocketledger.exception.AtomicityFailureException;
import com.pocketledger.exception.InvalidReferenceException;
import com.pocketledger.exception.InvalidTransferException;
import com.pocketledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Moves value between two accounts of the same user.
 *
 * A transfer is two postings, TRANSFER_OUT on the source and TRANSFER_IN on the
 * destination, created together in ONE BalanceEngine call so that either both
 * legs and both deltas commit or neither does.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final AccountRepository accountRepository;
    private final CategoryService categoryService;
    private final BalanceEngine balanceEngine;

    public TransferService(AccountRepository accountRepository,
                           CategoryService categoryService,
                           BalanceEngine balanceEngine) {
        this.accountRepository = accountRepository;
        this.categoryService = categoryService;
        this.balanceEngine = balanceEngine;
    }

    /**
     * The two postings of a completed transfer.
     */
    public record TransferResult(Transaction debit, Transaction credit) {
    }

    /**
     * @param date        transaction date of both legs; now when null
     * @param description used for both legs when given, otherwise each leg names the other account
     * @throws InvalidTransferException  if source equals destination, or amount is not positive or does not fit the amount column
     * @throws InvalidReferenceException if either account is not the user's
     */
    public TransferResult transfer(Long userId, Long sourceAccountId, Long destinationAccountId,
                                   BigDecimal amount, Instant date, String description) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidTransferException("Transfer amount must be positive. Got: " + amount);
        }
        if (!Transaction.fitsAmountColumn(amount)) {
            throw new InvalidTransferException(String.format(
                    "Transfer amount must have at most %d integer digits and %d decimals. Got: %s",
                    Transaction.MAX_INTEGER_DIGITS, Transaction.MAX_FRACTION_DIGITS, amount.toPlainString()));
        }
        if (sourceAccountId != null && sourceAccountId.equals(destinationAccountId)) {
            throw new InvalidTransferException("Source and destination accounts must differ");
        }

        Account source = ownedAccount(userId, sourceAccountId);
        Account destination = ownedAccount(userId, destinationAccountId);
        Category transferCategory = categoryService.resolveTransferCategory(userId);

        boolean hasDescription = description != null && !description.isBlank();
        Instant when = date != null ? date : Instant.now();

        List<TransactionDraft> legs = List.of(
                new TransactionDraft(
                        hasDescription ? description : "Transfer to " + destination.getName(),
                        amount, Transaction.TransactionType.TRANSFER_OUT, when,
                        source.getId(), transferCategory.getId()),
                new TransactionDraft(
                        hasDescription ? description : "Transfer from " + source.getName(),
                        amount, Transaction.TransactionType.TRANSFER_IN, when,
                        destination.getId(), transferCategory.getId())
        );

        List<Transaction> posted;
        try {
            posted = balanceEngine.applyCreateAll(userId, legs);
        } catch (DataAccessException | TransactionException e) {
            log.error("Transfer {} -> {} of {} aborted by the store, nothing was committed",
                    sourceAccountId, destinationAccountId, amount, e);
            throw new AtomicityFailureException("Transfer failed and was rolled back", e);
        }

        log.info("Transfer complete - userId={}, from={}, to={}, amount={}, debitId={}, creditId={}",
                userId, sourceAccountId, destinationAccountId, amount,
                posted.get(0).getId(), posted.get(1).getId());
        return new TransferResult(posted.get(0), posted.get(1));
    }

    private Account ownedAccount(Long userId, Long accountId) {
        if (accountId == null) {
            throw new InvalidReferenceException("Account is required");
        }
        return accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> InvalidReferenceException.account(accountId));
    }
}
