package com.pocketledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pocketledger.domain.Account;
import com.pocketledger.domain.Category;
import com.pocketledger.domain.Transaction;
import com.pocketledger.domain.User;
import com.pocketledger.service.AccountBalance;
import com.pocketledger.service.DateRange;
import com.pocketledger.service.PeriodBalance;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Plain acknowledgement.
     */
    public static class MessageResponse {
        private String message;

        public MessageResponse(String message) {
            this.message = message;
        }

        public String getMessage() { return message; }
    }

    /**
     * Caller profile.
     */
    public static class UserResponse {
        private Long id;
        private String name;
        private String email;
        private boolean verified;
        private Instant createdAt;

        public UserResponse(User user) {
            this.id = user.getId();
            this.name = user.getName();
            this.email = user.getEmail();
            this.verified = user.isVerified();
            this.createdAt = user.getCreatedAt();
        }

        public Long getId() { return id; }
        public String getName() { return name; }
        public String getEmail() { return email; }
        public boolean isVerified() { return verified; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Account with its cached balance.
     */
    public static class AccountResponse {
        private Long id;
        private String name;
        private String type;
        private BigDecimal initialBalance;
        private BigDecimal currentBalance;
        private String color;
        private String icon;
        private Instant createdAt;
        private Instant updatedAt;

        public AccountResponse(Account account) {
            this.id = account.getId();
            this.name = account.getName();
            this.type = account.getType().toString();
            this.initialBalance = account.getInitialBalance();
            this.currentBalance = account.getCurrentBalance();
            this.color = account.getColor();
            this.icon = account.getIcon();
            this.createdAt = account.getCreatedAt();
            this.updatedAt = account.getUpdatedAt();
        }

        public Long getId() { return id; }
        public String getName() { return name; }
        public String getType() { return type; }
        public BigDecimal getInitialBalance() { return initialBalance; }
        public BigDecimal getCurrentBalance() { return currentBalance; }
        public String getColor() { return color; }
        public String getIcon() { return icon; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    public static class CategoryResponse {
        private Long id;
        private String name;

        public CategoryResponse(Category category) {
            this.id = category.getId();
            this.name = category.getName();
        }

        public Long getId() { return id; }
        public String getName() { return name; }
    }

    /**
     * Transaction response.
     */
    public static class TransactionResponse {
        private Long id;
        private String description;
        private BigDecimal amount;
        private String type;
        private Instant date;
        private Long accountId;
        private String accountName;
        private Long categoryId;
        private String categoryName;
        private Instant createdAt;

        public TransactionResponse(Transaction tx) {
            this.id = tx.getId();
            this.description = tx.getDescription();
            this.amount = tx.getAmount();
            this.type = tx.getType().toString();
            this.date = tx.getTransactionDate();
            this.accountId = tx.getAccount().getId();
            this.accountName = tx.getAccount().getName();
            this.categoryId = tx.getCategory().getId();
            this.categoryName = tx.getCategory().getName();
            this.createdAt = tx.getCreatedAt();
        }

        public Long getId() { return id; }
        public String getDescription() { return description; }
        public BigDecimal getAmount() { return amount; }
        public String getType() { return type; }
        public Instant getDate() { return date; }
        public Long getAccountId() { return accountId; }
        public String getAccountName() { return accountName; }
        public Long getCategoryId() { return categoryId; }
        public String getCategoryName() { return categoryName; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Transfer response: both legs.
     */
    public static class TransferResponse {
        private TransactionResponse debit;
        private TransactionResponse credit;
        private BigDecimal amount;

        public TransferResponse(Transaction debitLeg, Transaction creditLeg) {
            this.debit = new TransactionResponse(debitLeg);
            this.credit = new TransactionResponse(creditLeg);
            this.amount = creditLeg.getAmount();
        }

        public TransactionResponse getDebit() { return debit; }
        public TransactionResponse getCredit() { return credit; }
        public BigDecimal getAmount() { return amount; }
    }

    /**
     * Reconstructed balance of one account.
     *
     * cachedBalance is only reported for full-history reports; period figures
     * only when a date range was requested.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BalanceResponse {
        private Long accountId;
        private String accountName;
        private BigDecimal balance;
        private BigDecimal cachedBalance;
        private Period period;
        private BigDecimal openingBalance;
        private BigDecimal closingBalance;
        private BigDecimal periodNet;

        public BalanceResponse(AccountBalance report) {
            this.accountId = report.account().getId();
            this.accountName = report.account().getName();
            this.balance = report.balance();
            if (report.range() == null) {
                this.cachedBalance = report.account().getCurrentBalance();
            } else {
                this.period = new Period(report.range());
            }
            PeriodBalance figures = report.period();
            if (figures != null) {
                this.openingBalance = figures.opening();
                this.closingBalance = figures.closing();
                this.periodNet = figures.net();
            }
        }

        public Long getAccountId() { return accountId; }
        public String getAccountName() { return accountName; }
        public BigDecimal getBalance() { return balance; }
        public BigDecimal getCachedBalance() { return cachedBalance; }
        public Period getPeriod() { return period; }
        public BigDecimal getOpeningBalance() { return openingBalance; }
        public BigDecimal getClosingBalance() { return closingBalance; }
        public BigDecimal getPeriodNet() { return periodNet; }
    }

    /**
     * Requested range; an open bound is reported as null.
     */
    public static class Period {
        private Instant start;
        private Instant end;

        public Period(DateRange range) {
            this.start = range.isStartOpen() ? null : range.start();
            this.end = range.isEndOpen() ? null : range.end();
        }

        public Instant getStart() { return start; }
        public Instant getEnd() { return end; }
    }

    public static class ReceiptUploadResponse {
        private String message;
        private String key;

        public ReceiptUploadResponse(String message, String key) {
            this.message = message;
            this.key = key;
        }

        public String getMessage() { return message; }
        public String getKey() { return key; }
    }

    /**
     * Error response: {@code error} is the human readable message, {@code code}
     * the machine readable kind.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private String error;
        private String code;
        private Instant timestamp;
        private Map<String, String> details;

        public ErrorResponse(String code, String error) {
            this(code, error, null);
        }

        public ErrorResponse(String code, String error, Map<String, String> details) {
            this.code = code;
            this.error = error;
            this.details = details;
            this.timestamp = Instant.now();
        }

        public String getError() { return error; }
        public String getCode() { return code; }
        public Instant getTimestamp() { return timestamp; }
        public Map<String, String> getDetails() { return details; }
    }
}
