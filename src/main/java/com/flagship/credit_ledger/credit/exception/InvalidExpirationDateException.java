package com.flagship.credit_ledger.credit.exception;

/**
 * Expiration date is in the past, not later than the current one, or not yet reached.
 */
public class InvalidExpirationDateException extends CreditLedgerException {

    public InvalidExpirationDateException(String message) {
        super(ErrorKind.INVALID_EXPIRATION_DATE, message);
    }
}
