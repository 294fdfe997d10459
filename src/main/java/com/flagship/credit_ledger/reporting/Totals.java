package com.flagship.credit_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Overall count and signed amount sum, plus one entry per group (empty for {@link GroupBy#NONE}).
 * Groups are ordered by key.
 */
@Value
public final class Totals implements AggregateResult {
    GroupBy groupBy;
    long count;
    BigDecimal sum;
    List<GroupTotal> groups;
}
