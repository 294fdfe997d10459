package com.flagship.credit_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class GroupTotal {
    String key;
    long count;
    BigDecimal sum;
}
