package com.flagship.credit_ledger.credit.exception;

public class CreditNotFoundException extends CreditLedgerException {

    public CreditNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
