package com.flagship.credit_ledger.expiration;

import lombok.Value;

@Value
public class ReminderResult {
    int daysUntil;
    int candidates;
    int sent;

    public int getFailed() {
        return candidates - sent;
    }
}
