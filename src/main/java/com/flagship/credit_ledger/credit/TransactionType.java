package com.flagship.credit_ledger.credit;

/**
 * Kind of ledger entry recorded against a credit.
 */
public enum TransactionType {
    ISSUE,
    REDEEM,
    ADJUST,
    CANCEL,
    EXPIRE,
    /**
     * Zero-amount audit entry recording a change of expiration date.
     */
    EXTEND_EXPIRATION
}
