package com.pocketledger.repository;

import com.pocketledger.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Account entity.
 *
 * Custom Queries Explained:
 *
 * 1. applyBalanceDelta(accountId, delta, now)
 *    WHY: the cached balance must never be written as an absolute value computed
 *         in Java (read-modify-write loses concurrent updates).
 *    HOW: a single relative UPDATE; the database row lock taken by the UPDATE
 *         serializes concurrent postings to the same account until commit.
 *    VERSION: bumped on every delta so a concurrent metadata edit holding a stale
 *         copy of the row fails with an optimistic-lock error instead of writing
 *         the stale balance back.
 *    RETURNS: rows touched. Anything other than 1 means the account vanished and
 *         the caller must abort the unit.
 *
 * 2. findByIdAndUserId / existsByIdAndUserId
 *    WHY: ownership checks in one query; a foreign account looks the same as a
 *         missing one to the caller.
 *
 * Design Notes:
 * - No @Transactional here (service layer manages transaction boundaries)
 * - clearAutomatically keeps managed Account instances from serving the stale
 *   pre-update balance later in the same persistence context
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    List<Account> findByUserIdOrderByIdAsc(Long userId);

    List<Account> findByIdInAndUserId(Collection<Long> ids, Long userId);

    Optional<Account> findByIdAndUserId(Long id, Long userId);

    boolean existsByIdAndUserId(Long id, Long userId);

    /**
     * Cached balance read straight from the row, bypassing any managed Account
     * instance. Used as the anchor of period reports.
     */
    @Query("SELECT a.currentBalance FROM Account a WHERE a.id = :accountId")
    Optional<BigDecimal> findCurrentBalance(@Param("accountId") Long accountId);

    /**
     * Add {@code delta} (possibly negative) to the cached balance.
     *
     * Example SQL generated:
     * UPDATE accounts SET current_balance = current_balance + ?, version = version + 1,
     *        updated_at = ? WHERE id = ?
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Account a SET a.currentBalance = a.currentBalance + :delta, " +
           "a.version = a.version + 1, a.updatedAt = :now WHERE a.id = :accountId")
    int applyBalanceDelta(@Param("accountId") Long accountId,
                          @Param("delta") BigDecimal delta,
                          @Param("now") Instant now);
}
