package com.flagship.credit_ledger.credit;

import lombok.Value;

/**
 * A credit's new state together with the single ledger entry that explains it.
 *
 * The ledger store writes both halves in one transaction or neither.
 */
@Value
public class CreditPosting {
    Credit credit;
    CreditTransaction transaction;
}
