package com.flagship.credit_ledger.notification;

import java.util.UUID;

/**
 * Callbacks fired after a ledger change has committed.
 *
 * Implementations deliver emails, push messages or webhooks. They are called
 * synchronously on the thread that performed the operation, but only once the data is
 * durable, and any exception they throw is logged and dropped: a failing hook never undoes
 * or fails a ledger operation.
 */
public interface CreditNotificationHook {

    void onIssued(UUID creditId);

    /**
     * @param daysUntil whole days until the credit's expiration date
     */
    void onExpiring(UUID creditId, int daysUntil);

    void onRedeemed(UUID creditId, UUID transactionId);
}
