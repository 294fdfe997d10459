package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.credit.CreditTransaction;
import com.flagship.credit_ledger.credit.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("credit_id")
    UUID creditId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("staff_id")
    String staffId;

    @JsonProperty("location_id")
    String locationId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("note")
    String note;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    public static TransactionResponse from(CreditTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .creditId(tx.getCreditId())
            .type(tx.getType())
            .amount(tx.getAmount())
            .balanceAfter(tx.getBalanceAfter())
            .currency(tx.getCurrency().name())
            .staffId(tx.getStaffId())
            .locationId(tx.getLocationId())
            .orderId(tx.getOrderId())
            .orderNumber(tx.getOrderNumber())
            .note(tx.getNote())
            .metadata(tx.getMetadata())
            .timestamp(tx.getTimestamp())
            .sequenceNumber(tx.getSequenceNumber())
            .build();
    }
}
