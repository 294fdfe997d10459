package com.flagship.credit_ledger.credit.exception;

/**
 * No free credit code was found within the configured number of attempts.
 */
public class CodeGenerationExhaustedException extends CreditLedgerException {

    public CodeGenerationExhaustedException(String message) {
        super(ErrorKind.CODE_GENERATION_EXHAUSTED, message);
    }
}
