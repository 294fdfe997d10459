package com.flagship.credit_ledger.credit.exception;

import lombok.Getter;

/**
 * Base class for every failure raised by the credit ledger.
 *
 * Callers switch on {@link #getKind()} to render an actionable message; the subclasses
 * exist so that call sites and tests can catch one specific failure.
 */
@Getter
public class CreditLedgerException extends RuntimeException {

    private final ErrorKind kind;

    public CreditLedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CreditLedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
