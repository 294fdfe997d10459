package com.flagship.credit_ledger.reporting;

import com.flagship.credit_ledger.credit.CreditStatus;
import com.flagship.credit_ledger.credit.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Value
public class CreditStats {
    Map<CreditStatus, Long> creditsByStatus;
    List<CurrencyTotals> currencies;

    /**
     * Money figures for one currency. redeemed is positive; outstanding is the sum of all
     * current balances.
     */
    @Value
    public static class CurrencyTotals {
        CurrencyCode currency;
        BigDecimal issued;
        BigDecimal redeemed;
        BigDecimal outstanding;
    }
}
