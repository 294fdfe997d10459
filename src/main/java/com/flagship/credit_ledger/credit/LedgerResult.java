package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.event.CreditEvent;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a committed lifecycle operation.
 *
 * events is the side channel for notifications: the service hands it to the notification
 * dispatcher only after the ledger transaction has committed.
 */
@Value
public class LedgerResult {
    Credit credit;
    CreditTransaction transaction;
    List<CreditEvent> events;
    /**
     * True when an idempotent issuance matched an earlier request and nothing new was written.
     */
    boolean replayed;

    public static LedgerResult committed(CreditPosting posting, CreditEvent event) {
        return new LedgerResult(posting.getCredit(), posting.getTransaction(), List.of(event), false);
    }

    public static LedgerResult replayed(Credit credit, CreditTransaction issueTransaction) {
        return new LedgerResult(credit, issueTransaction, List.of(), true);
    }
}
