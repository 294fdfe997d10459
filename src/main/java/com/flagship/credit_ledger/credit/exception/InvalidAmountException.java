package com.flagship.credit_ledger.credit.exception;

/**
 * Amount is zero, negative or otherwise unusable for the requested operation.
 */
public class InvalidAmountException extends CreditLedgerException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }
}
