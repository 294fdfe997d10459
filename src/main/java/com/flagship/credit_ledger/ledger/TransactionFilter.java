package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.credit.CreditTransaction;
import com.flagship.credit_ledger.credit.CurrencyCode;
import com.flagship.credit_ledger.credit.TransactionType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.UUID;

/**
 * Selection criteria for ledger queries. Null fields and an empty type set match everything.
 */
@Value
@Builder
public class TransactionFilter {
    String customerId;
    UUID creditId;
    @Singular
    Set<TransactionType> types;
    String staffId;
    String locationId;
    CurrencyCode currency;

    public static TransactionFilter all() {
        return TransactionFilter.builder().build();
    }

    public boolean matches(CreditTransaction tx) {
        return (customerId == null || customerId.equals(tx.getCustomerId()))
            && (creditId == null || creditId.equals(tx.getCreditId()))
            && (types.isEmpty() || types.contains(tx.getType()))
            && (staffId == null || staffId.equals(tx.getStaffId()))
            && (locationId == null || locationId.equals(tx.getLocationId()))
            && (currency == null || currency == tx.getCurrency());
    }
}
