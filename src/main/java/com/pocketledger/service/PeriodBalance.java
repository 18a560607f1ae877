package com.pocketledger.service;

import java.math.BigDecimal;

/**
 * Balance at the start and end of a range, plus the signed net posted within it.
 * closing - opening always equals net.
 */
public record PeriodBalance(BigDecimal opening, BigDecimal closing, BigDecimal net) {
}
