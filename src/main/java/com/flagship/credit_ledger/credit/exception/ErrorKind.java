package com.flagship.credit_ledger.credit.exception;

/**
 * Failure kinds surfaced by ledger operations.
 *
 * Only {@link #CONCURRENT_MODIFICATION} is transient; every other kind describes a request
 * that will fail the same way when repeated.
 */
public enum ErrorKind {
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,
    CREDIT_NOT_ACTIVE,
    ALREADY_TERMINAL,
    ADJUSTMENT_OUT_OF_RANGE,
    INVALID_EXPIRATION_DATE,
    NOT_FOUND,
    CONCURRENT_MODIFICATION,
    CODE_GENERATION_EXHAUSTED;

    public boolean isRetryable() {
        return this == CONCURRENT_MODIFICATION;
    }
}
