package com.flagship.credit_ledger.notification;

import com.flagship.credit_ledger.credit.LedgerResult;
import com.flagship.credit_ledger.credit.event.CreditEvent;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns the events of a committed operation into hook calls.
 *
 * Must only be handed results whose transaction has committed. Hook failures are logged
 * and counted here and never propagate to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final CreditNotificationHook hook;
    private final CreditMetrics metrics;

    public void dispatch(LedgerResult result) {
        for (CreditEvent event : result.getEvents()) {
            switch (event.getTransactionType()) {
                case ISSUE -> invoke("onIssued", event.getCreditId(), () -> hook.onIssued(event.getCreditId()));
                case REDEEM -> invoke("onRedeemed", event.getCreditId(),
                    () -> hook.onRedeemed(event.getCreditId(), event.getTransactionId()));
                default -> log.trace("No notification for {} on credit {}", event.getEventType(), event.getCreditId());
            }
        }
    }

    /**
     * @return true if the hook completed without throwing
     */
    public boolean notifyExpiring(UUID creditId, int daysUntil) {
        return invoke("onExpiring", creditId, () -> hook.onExpiring(creditId, daysUntil));
    }

    private boolean invoke(String callback, UUID creditId, Runnable call) {
        try {
            call.run();
            return true;
        } catch (Exception e) {
            log.warn("Notification hook {} failed for credit {}: {}", callback, creditId, e.getMessage(), e);
            metrics.recordNotificationFailure(callback);
            return false;
        }
    }
}
