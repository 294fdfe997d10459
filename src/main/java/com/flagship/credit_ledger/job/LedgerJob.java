package com.flagship.credit_ledger.job;

/**
 * Background work the ledger knows how to run.
 *
 * Each job kind has a visitor method; adding a kind means adding one, which makes
 * every runner fail to compile until it handles the new kind.
 */
public interface LedgerJob {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIssue(IssueJob job);

        R visitExpireSweep(ExpireSweepJob job);

        R visitNotify(NotifyJob job);
    }
}
