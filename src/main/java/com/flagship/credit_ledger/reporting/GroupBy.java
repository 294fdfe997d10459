package com.flagship.credit_ledger.reporting;

/**
 * Grouping dimension for aggregate reports. DAY, WEEK and MONTH produce a time series;
 * everything else produces totals.
 */
public enum GroupBy {
    NONE,
    TYPE,
    STAFF,
    LOCATION,
    CURRENCY,
    DAY,
    WEEK,
    MONTH;

    public boolean isTimeBucketed() {
        return this == DAY || this == WEEK || this == MONTH;
    }
}
