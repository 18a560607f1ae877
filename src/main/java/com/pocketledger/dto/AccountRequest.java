package com.pocketledger.dto;

import com.pocketledger.domain.Account;
import com.pocketledger.service.AccountDetails;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for account create/update requests.
 *
 * On create, name is required (checked by the entity) and type/initialBalance
 * default to CHECKING/0. On update, absent fields stay unchanged and
 * initialBalance is ignored.
 */
public class AccountRequest {

    @Size(max = 120, message = "Name must be at most 120 characters")
    private String name;

    private Account.AccountType type;

    @Digits(integer = 15, fraction = 4, message = "Initial balance must have at most 15 integer digits and 4 decimals")
    private BigDecimal initialBalance;

    @Size(max = 20, message = "Color must be at most 20 characters")
    private String color;

    @Size(max = 50, message = "Icon must be at most 50 characters")
    private String icon;

    public AccountRequest() {
    }

    public AccountRequest(String name, Account.AccountType type, BigDecimal initialBalance) {
        this.name = name;
        this.type = type;
        this.initialBalance = initialBalance;
    }

    public AccountDetails toDetails() {
        return new AccountDetails(name, type, initialBalance, color, icon);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Account.AccountType getType() {
        return type;
    }

    public void setType(Account.AccountType type) {
        this.type = type;
    }

    public BigDecimal getInitialBalance() {
        return initialBalance;
    }

    public void setInitialBalance(BigDecimal initialBalance) {
        this.initialBalance = initialBalance;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }
}
