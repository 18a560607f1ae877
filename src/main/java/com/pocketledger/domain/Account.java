package com.pocketledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Account entity: a place money lives (checking account, cash, credit card...).
 *
 * Balance rules:
 * - initialBalance is a snapshot taken at creation and never changes
 * - currentBalance is a cache: initialBalance + signed sum of every transaction
 *   posted against this account
 * - currentBalance has NO setter; it is only moved by BalanceEngine through
 *   AccountRepository.applyBalanceDelta, a relative UPDATE executed by the database
 *
 * The version column is bumped by every balance delta as well as by metadata
 * edits, so a metadata edit racing a posting fails instead of writing back a
 * stale balance.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_user_id", columnList = "user_id")
    }
)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(nullable = false, length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountType type;

    @Column(name = "initial_balance", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal initialBalance;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal currentBalance;

    @Column(length = 20)
    private String color;

    @Column(length = 50)
    private String icon;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum AccountType {
        CHECKING,
        SAVINGS,
        INVESTMENT,
        CASH,
        CREDIT_CARD
    }

    protected Account() {
    }

    /**
     * Open a new account. The cached balance starts equal to the initial balance.
     *
     * @param user           the owner
     * @param name           display name
     * @param type           account kind
     * @param initialBalance opening balance, may be negative (credit cards); null means zero
     * @param color          optional display color
     * @param icon           optional display icon
     */
    public Account(User user, String name, AccountType type, BigDecimal initialBalance, String color, String icon) {
        if (user == null) {
            throw new IllegalArgumentException("User cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        BigDecimal opening = initialBalance != null ? initialBalance : BigDecimal.ZERO;
        this.user = user;
        this.name = name.strip();
        this.type = type != null ? type : AccountType.CHECKING;
        this.initialBalance = opening;
        this.currentBalance = opening;
        this.color = color;
        this.icon = icon;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public Long getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    public String getName() {
        return name;
    }

    public AccountType getType() {
        return type;
    }

    public BigDecimal getInitialBalance() {
        return initialBalance;
    }

    /**
     * Cached running balance as of the moment this entity was loaded.
     */
    public BigDecimal getCurrentBalance() {
        return currentBalance;
    }

    public String getColor() {
        return color;
    }

    public String getIcon() {
        return icon;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }

    /**
     * Change display attributes. Balances are never touched here.
     * Null arguments leave the attribute unchanged.
     */
    public void updateDetails(String name, AccountType type, String color, String icon) {
        if (name != null) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Account name cannot be blank");
            }
            this.name = name.strip();
        }
        if (type != null) {
            this.type = type;
        }
        if (color != null) {
            this.color = color;
        }
        if (icon != null) {
            this.icon = icon;
        }
        this.updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return id != null && Objects.equals(id, account.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", userId=" + (user != null ? user.getId() : null) +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", currentBalance=" + currentBalance +
                ", version=" + version +
                '}';
    }
}
