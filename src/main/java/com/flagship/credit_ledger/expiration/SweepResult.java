package com.flagship.credit_ledger.expiration;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one expiration sweep.
 *
 * skippedCount counts credits that were already terminal by the time the sweep reached
 * them, for example because they were redeemed or cancelled concurrently.
 */
@Value
public class SweepResult {
    Instant asOf;
    int expiredCount;
    int skippedCount;
    List<SweepFailure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
