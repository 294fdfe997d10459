package com.flagship.credit_ledger.credit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input for a redemption. The order fields are provenance only and are copied onto the entry.
 */
@Value
@Builder
public class RedeemCreditCommand {
    UUID creditId;
    BigDecimal amount;
    String orderId;
    String orderNumber;
    String staffId;
    String locationId;
    String note;
}
