package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;

@Value
public class ExtendExpirationRequest {

    @NotNull(message = "New expiration date is required")
    @JsonProperty("new_expiration_date")
    Instant newExpirationDate;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
