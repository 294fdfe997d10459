package com.flagship.credit_ledger.credit.exception;

/**
 * Credit row changed underneath the caller, the row lock could not be acquired in time,
 * or a unique key was taken by a concurrent insert.
 *
 * This is the one failure that is safe to retry.
 */
public class CreditConcurrentModificationException extends CreditLedgerException {

    public CreditConcurrentModificationException(String message) {
        super(ErrorKind.CONCURRENT_MODIFICATION, message);
    }

    public CreditConcurrentModificationException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENT_MODIFICATION, message, cause);
    }
}
