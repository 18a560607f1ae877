package com.pocketledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for editing a transaction. Every field is optional.
 *
 * A type field is tolerated for client compatibility but never applied:
 * a transaction keeps the type it was created with.
 */
public class TransactionUpdateRequest {

    @Size(max = 255, message = "Description must be at most 255 characters")
    private String description;

    @DecimalMin(value = "0", inclusive = false, message = "Amount must be positive")
    @Digits(integer = 15, fraction = 4, message = "Amount must have at most 15 integer digits and 4 decimals")
    private BigDecimal amount;

    private String type;

    private String date;

    private Long categoryId;

    private Long accountId;

    public TransactionUpdateRequest() {
    }

    public TransactionUpdateRequest(String description, BigDecimal amount, String date,
                                    Long categoryId, Long accountId) {
        this.description = description;
        this.amount = amount;
        this.date = date;
        this.categoryId = categoryId;
        this.accountId = accountId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }

    public Long getAccountId() {
        return accountId;
    }

    public void setAccountId(Long accountId) {
        this.accountId = accountId;
    }
}
