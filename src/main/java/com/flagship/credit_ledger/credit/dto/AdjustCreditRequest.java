package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Signed balance change: positive adds to the balance, negative removes from it.
 */
@Value
public class AdjustCreditRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
