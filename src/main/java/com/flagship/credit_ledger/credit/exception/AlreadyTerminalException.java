package com.flagship.credit_ledger.credit.exception;

/**
 * Credit already reached USED, EXPIRED or CANCELLED; nothing was recorded.
 */
public class AlreadyTerminalException extends CreditLedgerException {

    public AlreadyTerminalException(String message) {
        super(ErrorKind.ALREADY_TERMINAL, message);
    }
}
