package com.flagship.credit_ledger.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Default hook used when no delivery integration is configured; logs each notification.
 */
@Slf4j
public class LoggingNotificationHook implements CreditNotificationHook {

    @Override
    public void onIssued(UUID creditId) {
        log.info("Notification: credit {} issued", creditId);
    }

    @Override
    public void onExpiring(UUID creditId, int daysUntil) {
        log.info("Notification: credit {} expires in {} day(s)", creditId, daysUntil);
    }

    @Override
    public void onRedeemed(UUID creditId, UUID transactionId) {
        log.info("Notification: credit {} redeemed by transaction {}", creditId, transactionId);
    }
}
