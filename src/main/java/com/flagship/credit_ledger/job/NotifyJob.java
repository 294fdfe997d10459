package com.flagship.credit_ledger.job;

import lombok.Value;

import java.time.Instant;

/**
 * Expiration reminders for credits expiring daysUntil days after asOf.
 */
@Value
public final class NotifyJob implements LedgerJob {
    Instant asOf;
    int daysUntil;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNotify(this);
    }
}
