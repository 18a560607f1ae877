package com.pocketledger.service;

import com.pocketledger.domain.Account;

import java.math.BigDecimal;

/**
 * Reconstructed balance report for one account.
 *
 * @param account the account, with its cached balance as loaded
 * @param balance initial balance plus the signed net of the (optionally ranged) history
 * @param range   the range applied, or null for full history
 * @param period  opening/closing figures when a range was requested, else null
 */
public record AccountBalance(Account account, BigDecimal balance, DateRange range, PeriodBalance period) {
}
