package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RedeemCreditRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 100)
    @JsonProperty("order_id")
    String orderId;

    @Size(max = 100)
    @JsonProperty("order_number")
    String orderNumber;

    @Size(max = 100)
    @JsonProperty("location_id")
    String locationId;

    @Size(max = 500)
    @JsonProperty("note")
    String note;
}
