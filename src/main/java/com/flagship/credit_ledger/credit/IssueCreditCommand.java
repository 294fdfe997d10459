package com.flagship.credit_ledger.credit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Input for issuing a credit. expirationDate null means the credit never expires.
 */
@Value
@Builder(toBuilder = true)
public class IssueCreditCommand {
    String customerId;
    BigDecimal amount;
    CurrencyCode currency;
    Instant expirationDate;
    String note;
    String staffId;
    String locationId;
    /**
     * Optional caller key; repeating an issuance with the same key returns the first credit.
     */
    String idempotencyKey;
}
