package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CreditResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("original_amount")
    BigDecimal originalAmount;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    CreditStatus status;

    @JsonProperty("expiration_date")
    Instant expirationDate;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CreditResponse from(Credit credit) {
        return CreditResponse.builder()
            .id(credit.getId())
            .code(credit.getCode())
            .originalAmount(credit.getOriginalAmount())
            .balance(credit.getBalance())
            .currency(credit.getCurrency().name())
            .status(credit.getStatus())
            .expirationDate(credit.getExpirationDate())
            .customerId(credit.getCustomerId())
            .note(credit.getNote())
            .createdAt(credit.getCreatedAt())
            .updatedAt(credit.getUpdatedAt())
            .build();
    }
}
