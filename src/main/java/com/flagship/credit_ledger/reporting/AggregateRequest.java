package com.flagship.credit_ledger.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.credit.CurrencyCode;
import com.flagship.credit_ledger.credit.TransactionType;
import com.flagship.credit_ledger.ledger.DateRange;
import com.flagship.credit_ledger.ledger.TransactionFilter;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Body of POST /api/reports/aggregate. Every filter field is optional.
 */
@Value
public class AggregateRequest {

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("credit_id")
    UUID creditId;

    @JsonProperty("types")
    Set<TransactionType> types;

    @JsonProperty("staff_id")
    String staffId;

    @JsonProperty("location_id")
    String locationId;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("group_by")
    GroupBy groupBy;

    @JsonProperty("from")
    Instant from;

    @JsonProperty("to")
    Instant to;

    public TransactionFilter toFilter() {
        TransactionFilter.TransactionFilterBuilder builder = TransactionFilter.builder()
            .customerId(customerId)
            .creditId(creditId)
            .staffId(staffId)
            .locationId(locationId)
            .currency(currency);
        if (types != null) {
            builder.types(types);
        }
        return builder.build();
    }

    public DateRange toRange() {
        return new DateRange(from, to);
    }

    public GroupBy effectiveGroupBy() {
        return groupBy == null ? GroupBy.NONE : groupBy;
    }
}
