package com.flagship.credit_ledger.credit.exception;

/**
 * Redemption asks for more than the credit's remaining balance.
 */
public class InsufficientBalanceException extends CreditLedgerException {

    public InsufficientBalanceException(String message) {
        super(ErrorKind.INSUFFICIENT_BALANCE, message);
    }
}
