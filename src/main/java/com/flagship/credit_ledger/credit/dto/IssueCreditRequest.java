package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request body for issuing a credit. Amount sign and expiration date are checked by the
 * ledger itself so they fail with the ledger's error kinds.
 */
@Value
public class IssueCreditRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @Size(max = 100)
    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("expiration_date")
    Instant expirationDate;

    @Size(max = 500)
    @JsonProperty("note")
    String note;

    @Size(max = 100)
    @JsonProperty("location_id")
    String locationId;
}
