package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.credit.LedgerResult;
import lombok.Value;

/**
 * Credit state after an operation together with the entry that produced it.
 */
@Value
public class LedgerResultResponse {

    @JsonProperty("credit")
    CreditResponse credit;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("replayed")
    boolean replayed;

    public static LedgerResultResponse from(LedgerResult result) {
        return new LedgerResultResponse(
            CreditResponse.from(result.getCredit()),
            TransactionResponse.from(result.getTransaction()),
            result.isReplayed());
    }
}
