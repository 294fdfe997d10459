package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CancelCreditRequest {

    @Size(max = 500)
    @JsonProperty("reason")
    String reason;
}
