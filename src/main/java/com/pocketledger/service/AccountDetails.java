package com.pocketledger.service;

import com.pocketledger.domain.Account;

import java.math.BigDecimal;

/**
 * Account attributes supplied on create/update. initialBalance is only read on create.
 */
public record AccountDetails(
        String name,
        Account.AccountType type,
        BigDecimal initialBalance,
        String color,
        String icon) {
}
