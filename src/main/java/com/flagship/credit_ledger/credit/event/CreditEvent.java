package com.flagship.credit_ledger.credit.event;

import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditStatus;
import com.flagship.credit_ledger.credit.CreditTransaction;
import com.flagship.credit_ledger.credit.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Fact published whenever a ledger entry is committed.
 *
 * One event per transaction. The event type is derived from the transaction type
 * (CreditIssued, CreditRedeemed, ...) and is used for outbox routing and notification
 * dispatch.
 */
@Value
public class CreditEvent {

    public static final String AGGREGATE_TYPE = "Credit";

    UUID eventId;
    String eventType;
    UUID creditId;
    String creditCode;
    String customerId;
    UUID transactionId;
    TransactionType transactionType;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String currency;
    CreditStatus status;
    Instant expirationDate;
    String staffId;
    Instant occurredAt;

    public static CreditEvent fromPosting(Credit credit, CreditTransaction transaction) {
        return new CreditEvent(
            UUID.randomUUID(),
            eventTypeFor(transaction.getType()),
            credit.getId(),
            credit.getCode(),
            credit.getCustomerId(),
            transaction.getId(),
            transaction.getType(),
            transaction.getAmount(),
            transaction.getBalanceAfter(),
            credit.getCurrency().name(),
            credit.getStatus(),
            credit.getExpirationDate(),
            transaction.getStaffId(),
            transaction.getTimestamp()
        );
    }

    public static String eventTypeFor(TransactionType type) {
        return switch (type) {
            case ISSUE -> "CreditIssued";
            case REDEEM -> "CreditRedeemed";
            case ADJUST -> "CreditAdjusted";
            case CANCEL -> "CreditCancelled";
            case EXPIRE -> "CreditExpired";
            case EXTEND_EXPIRATION -> "CreditExpirationExtended";
        };
    }
}
