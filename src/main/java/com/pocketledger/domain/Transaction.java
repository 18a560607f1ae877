package com.pocketledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Transaction entity: one posting against one account.
 *
 * FINANCIAL RULES:
 * 1. amount is always a positive magnitude; the direction comes from the type
 * 2. type is fixed at creation (no setter, column not updatable)
 * 3. every balance computation goes through {@link TransactionType#signedAmount(BigDecimal)}
 * 4. instances are created only by BalanceEngine, which posts the matching balance delta
 *    in the same database transaction
 *
 * transactionDate is the business date used for period queries and ordering;
 * createdAt is the technical insertion time.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_tx_account_date", columnList = "account_id,transaction_date"),
        @Index(name = "idx_tx_user_date", columnList = "user_id,transaction_date"),
        @Index(name = "idx_tx_category", columnList = "category_id")
    }
)
public class Transaction {

    public static final int MAX_INTEGER_DIGITS = 15;
    public static final int MAX_FRACTION_DIGITS = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionType type;

    @Column(name = "transaction_date", nullable = false)
    private Instant transactionDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    /**
     * Transaction kind. Carries the sign convention: the single place where
     * a type is turned into a balance direction.
     */
    public enum TransactionType {
        INCOME(1),
        EXPENSE(-1),
        TRANSFER_IN(1),
        TRANSFER_OUT(-1);

        private final int sign;

        TransactionType(int sign) {
            this.sign = sign;
        }

        /**
         * Convert a positive magnitude into the delta this type applies to its account.
         */
        public BigDecimal signedAmount(BigDecimal amount) {
            return sign > 0 ? amount : amount.negate();
        }

        public boolean isCredit() {
            return sign > 0;
        }

        /**
         * Case-insensitive lookup used for request parsing.
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static TransactionType parse(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Transaction type is required");
            }
            try {
                return TransactionType.valueOf(value.strip().toUpperCase(java.util.Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown transaction type: " + value, e);
            }
        }
    }

    protected Transaction() {
    }

    public Transaction(User user, Account account, Category category, TransactionType type,
                       BigDecimal amount, Instant transactionDate, String description) {
        if (user == null || account == null || category == null) {
            throw new IllegalArgumentException("User, account and category are required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        validateAmount(amount);
        if (transactionDate == null) {
            throw new IllegalArgumentException("Transaction date is required");
        }
        this.user = user;
        this.account = account;
        this.category = category;
        this.type = type;
        this.amount = amount;
        this.transactionDate = transactionDate;
        this.description = description != null ? description.strip() : "";
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public TransactionType getType() {
        return type;
    }

    public Instant getTransactionDate() {
        return transactionDate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public User getUser() {
        return user;
    }

    public Account getAccount() {
        return account;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * The delta this transaction contributes to its account's balance.
     */
    public BigDecimal signedAmount() {
        return type.signedAmount(amount);
    }

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }

    /**
     * Apply an edit. Type is immutable and not editable here.
     * Null arguments leave the field unchanged. Balance deltas for the edit
     * are the caller's (BalanceEngine's) responsibility.
     */
    public void revise(String description, BigDecimal amount, Instant transactionDate,
                       Category category, Account account) {
        if (amount != null) {
            validateAmount(amount);
            this.amount = amount;
        }
        if (description != null) {
            this.description = description.strip();
        }
        if (transactionDate != null) {
            this.transactionDate = transactionDate;
        }
        if (category != null) {
            this.category = category;
        }
        if (account != null) {
            this.account = account;
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Amount must be positive. Got: " + amount);
        }
        if (!fitsAmountColumn(amount)) {
            throw new IllegalArgumentException(String.format(
                    "Amount must have at most %d integer digits and %d decimals. Got: %s",
                    MAX_INTEGER_DIGITS, MAX_FRACTION_DIGITS, amount.toPlainString()));
        }
    }

    /**
     * Whether the value is stored exactly by the amount column (precision 19, scale 4).
     * Trailing zeros do not count, so 1.50000 fits and 0.00001 does not.
     */
    public static boolean fitsAmountColumn(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        int fractionDigits = Math.max(stripped.scale(), 0);
        int integerDigits = stripped.precision() - stripped.scale();
        return fractionDigits <= MAX_FRACTION_DIGITS && integerDigits <= MAX_INTEGER_DIGITS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "id=" + id +
                ", accountId=" + (account != null ? account.getId() : null) +
                ", type=" + type +
                ", amount=" + amount +
                ", transactionDate=" + transactionDate +
                '}';
    }
}
