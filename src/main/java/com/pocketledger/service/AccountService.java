package com.pocketledger.service;

import com.pocketledger.domain.Account;
import com.pocketledger.domain.User;
import com.pocketledger.exception.AccessDeniedException;
import com.pocketledger.exception.InvalidReferenceException;
import com.pocketledger.exception.ResourceInUseException;
import com.pocketledger.exception.ResourceNotFoundException;
import com.pocketledger.repository.AccountRepository;
import com.pocketledger.repository.TransactionRepository;
import com.pocketledger.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for account management and balance reporting.
 *
 * Account metadata edits go through JPA with optimistic locking on the same
 * version column the balance engine bumps, so an edit can never write a stale
 * cached balance back. Balances themselves are never changed here.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    /** Name of the account every new user starts with. */
    public static final String DEFAULT_ACCOUNT_NAME = "Wallet";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final UserRepository userRepository;
    private final BalanceEngine balanceEngine;

    public AccountService(AccountRepository accountRepository,
                          TransactionRepository transactionRepository,
                          UserRepository userRepository,
                          BalanceEngine balanceEngine) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.userRepository = userRepository;
        this.balanceEngine = balanceEngine;
    }

    public Account create(Long userId, AccountDetails details) {
        User owner = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        Account account = accountRepository.save(new Account(
                owner, details.name(), details.type(), details.initialBalance(), details.color(), details.icon()));
        log.info("Account created - userId={}, accountId={}, type={}, initialBalance={}",
                userId, account.getId(), account.getType(), account.getInitialBalance());
        return account;
    }

    /**
     * Provision the default cash account. Runs inside the registration transaction.
     */
    public Account createDefault(User owner) {
        return accountRepository.save(new Account(
                owner, DEFAULT_ACCOUNT_NAME, Account.AccountType.CASH, null, null, null));
    }

    @Transactional(readOnly = true)
    public List<Account> list(Long userId) {
        return accountRepository.findByUserIdOrderByIdAsc(userId);
    }

    /**
     * @throws ResourceNotFoundException if no account has this id
     * @throws AccessDeniedException     if it belongs to another user
     */
    @Transactional(readOnly = true)
    public Account get(Long userId, Long accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> ResourceNotFoundException.of("Account", accountId));
        if (!account.isOwnedBy(userId)) {
            throw new AccessDeniedException("You do not have permission to access account: " + accountId);
        }
        return account;
    }

    public Account update(Long userId, Long accountId, AccountDetails details) {
        Account account = get(userId, accountId);
        account.updateDetails(details.name(), details.type(), details.color(), details.icon());
        return accountRepository.save(account);
    }

    /**
     * @throws ResourceInUseException if any transaction references the account
     */
    public void delete(Long userId, Long accountId) {
        Account account = get(userId, accountId);
        if (transactionRepository.existsByAccountId(accountId)) {
            throw new ResourceInUseException(
                    "Account " + accountId + " has transactions and cannot be deleted");
        }
        accountRepository.delete(account);
        log.info("Account deleted - userId={}, accountId={}", userId, accountId);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // BALANCE REPORTING
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Full-history reconstruction for every account of the user.
     *
     * Reports run in a REPEATABLE_READ snapshot: the cached balance and the sums it
     * is compared with never straddle a concurrent commit.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<AccountBalance> balances(Long userId) {
        return accountRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(account -> report(account, null))
                .toList();
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AccountBalance balance(Long userId, Long accountId, DateRange range) {
        return report(get(userId, accountId), range);
    }

    /**
     * Reports for an explicit set of accounts, in request order.
     *
     * @throws InvalidReferenceException if any id is not one of the user's accounts
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<AccountBalance> balances(Long userId, List<Long> accountIds, DateRange range) {
        if (accountIds == null || accountIds.isEmpty()) {
            throw new IllegalArgumentException("At least one account id is required");
        }
        Set<Long> requested = new LinkedHashSet<>(accountIds);
        Map<Long, Account> owned = accountRepository.findByIdInAndUserId(requested, userId).stream()
                .collect(Collectors.toMap(Account::getId, Function.identity()));

        List<AccountBalance> reports = new ArrayList<>(requested.size());
        for (Long id : requested) {
            Account account = owned.get(id);
            if (account == null) {
                throw InvalidReferenceException.account(id);
            }
            reports.add(report(account, range));
        }
        return reports;
    }

    private AccountBalance report(Account account, DateRange range) {
        PeriodBalance period = range != null ? balanceEngine.reconstructOpeningClosing(account, range) : null;
        return new AccountBalance(account, balanceEngine.reconstructBalance(account, range), range, period);
    }
}
