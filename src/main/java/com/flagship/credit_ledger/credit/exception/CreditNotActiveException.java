package com.flagship.credit_ledger.credit.exception;

/**
 * Balance-changing operation attempted on a credit that is not ACTIVE or is past its
 * expiration date.
 */
public class CreditNotActiveException extends CreditLedgerException {

    public CreditNotActiveException(String message) {
        super(ErrorKind.CREDIT_NOT_ACTIVE, message);
    }
}
