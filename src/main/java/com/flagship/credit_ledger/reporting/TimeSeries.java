package com.flagship.credit_ledger.reporting;

import lombok.Value;

import java.util.List;

/**
 * Buckets in ascending order. Buckets without transactions are omitted.
 */
@Value
public final class TimeSeries implements AggregateResult {
    GroupBy groupBy;
    List<TimeBucket> buckets;
}
