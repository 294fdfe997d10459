package com.flagship.credit_ledger.job;

import lombok.Value;

import java.time.Instant;

@Value
public final class ExpireSweepJob implements LedgerJob {
    Instant asOf;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExpireSweep(this);
    }
}
