package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Half-open time range [from, to). A null bound is unbounded on that side.
 */
@Value
public class DateRange {
    Instant from;
    Instant to;

    public DateRange(Instant from, Instant to) {
        if (from != null && to != null && !to.isAfter(from)) {
            throw new IllegalArgumentException("Date range end " + to + " must be after start " + from);
        }
        this.from = from;
        this.to = to;
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public boolean contains(Instant instant) {
        return (from == null || !instant.isBefore(from))
            && (to == null || instant.isBefore(to));
    }
}
