package com.pocketledger.repository;

import com.pocketledger.domain.Transaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Transaction entity.
 *
 * Custom Queries Explained:
 *
 * 1. findByIdForUpdate(Long id)
 *    WHY: update and delete compute a revert from the row's current amount and
 *         account. Two concurrent edits of the same transaction must not both
 *         revert the same original values.
 *    LOCKING: PESSIMISTIC_WRITE (SELECT ... FOR UPDATE) until commit/rollback.
 *
 * 2. sumByType / sumByTypeBetween / sumByTypeAfter
 *    WHY: balance reconstruction independent of the cached balance.
 *    HOW: the database returns one raw magnitude total per type; the sign is
 *         applied in Java through TransactionType.signedAmount so the
 *         convention lives in exactly one place.
 *    RANGES: BETWEEN is inclusive on both ends; "after" is strictly greater.
 *
 * Design Notes:
 * - No @Transactional here (service layer manages transaction boundaries)
 * - Listing queries always take concrete bounds; open bounds are widened by
 *   DateRange before reaching the repository
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    /**
     * Raw per-type total of transaction amounts.
     */
    interface TypeTotal {
        Transaction.TransactionType getType();

        BigDecimal getTotal();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transaction t WHERE t.id = :id")
    Optional<Transaction> findByIdForUpdate(@Param("id") Long id);

    List<Transaction> findByUserIdAndTransactionDateBetweenOrderByTransactionDateDescIdDesc(
            Long userId, Instant start, Instant end);

    List<Transaction> findByUserIdAndAccountIdAndTransactionDateBetweenOrderByTransactionDateDescIdDesc(
            Long userId, Long accountId, Instant start, Instant end);

    List<Transaction> findByAccountIdOrderByTransactionDateAscIdAsc(Long accountId);

    boolean existsByAccountId(Long accountId);

    boolean existsByCategoryId(Long categoryId);

    @Query("SELECT t.type AS type, SUM(t.amount) AS total FROM Transaction t " +
           "WHERE t.account.id = :accountId GROUP BY t.type")
    List<TypeTotal> sumByType(@Param("accountId") Long accountId);

    @Query("SELECT t.type AS type, SUM(t.amount) AS total FROM Transaction t " +
           "WHERE t.account.id = :accountId AND t.transactionDate BETWEEN :start AND :end " +
           "GROUP BY t.type")
    List<TypeTotal> sumByTypeBetween(@Param("accountId") Long accountId,
                                     @Param("start") Instant start,
                                     @Param("end") Instant end);

    @Query("SELECT t.type AS type, SUM(t.amount) AS total FROM Transaction t " +
           "WHERE t.account.id = :accountId AND t.transactionDate > :end GROUP BY t.type")
    List<TypeTotal> sumByTypeAfter(@Param("accountId") Long accountId,
                                   @Param("end") Instant end);
}
