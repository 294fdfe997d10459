package com.flagship.credit_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One UTC day, ISO week (starting Monday) or calendar month, identified by its first instant.
 */
@Value
public class TimeBucket {
    Instant start;
    long count;
    BigDecimal sum;
}
