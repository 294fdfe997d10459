package com.flagship.credit_ledger.credit.exception;

/**
 * Adjustment would take the balance below zero or above the original amount.
 */
public class AdjustmentOutOfRangeException extends CreditLedgerException {

    public AdjustmentOutOfRangeException(String message) {
        super(ErrorKind.ADJUSTMENT_OUT_OF_RANGE, message);
    }
}
