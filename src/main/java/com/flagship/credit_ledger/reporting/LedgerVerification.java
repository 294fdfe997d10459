package com.flagship.credit_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Consistency check of one credit's stored balance against its history.
 */
@Value
public class LedgerVerification {
    UUID creditId;
    BigDecimal storedBalance;
    BigDecimal summedAmounts;
    BigDecimal latestBalanceAfter;
    List<String> problems;

    public boolean isConsistent() {
        return problems.isEmpty();
    }
}
