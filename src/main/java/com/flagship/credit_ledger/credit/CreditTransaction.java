package com.flagship.credit_ledger.credit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable ledger entry for a credit.
 *
 * amount is signed: positive for issuance and upward adjustments, negative for
 * redemptions, downward adjustments, cancellation and expiration, zero for expiration
 * extensions. balanceAfter is the credit's balance right after this entry, so the latest
 * entry always agrees with the stored balance.
 *
 * sequenceNumber is assigned by the store and orders a credit's history even when two
 * entries share a timestamp.
 */
@Value
@Builder
public class CreditTransaction {
    UUID id;
    UUID creditId;
    String customerId;
    TransactionType type;
    BigDecimal amount;
    BigDecimal balanceAfter;
    CurrencyCode currency;
    String staffId;
    String locationId;
    String orderId;
    String orderNumber;
    String note;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    Instant timestamp;
    @With
    Long sequenceNumber;

    /**
     * Starts a builder pre-filled with the identity, balance and currency of the credit
     * state this entry leads to.
     */
    public static CreditTransactionBuilder against(Credit after, TransactionType type, BigDecimal amount, Instant at) {
        return CreditTransaction.builder()
            .id(UUID.randomUUID())
            .creditId(after.getId())
            .customerId(after.getCustomerId())
            .type(type)
            .amount(amount)
            .balanceAfter(after.getBalance())
            .currency(after.getCurrency())
            .timestamp(at);
    }
}
