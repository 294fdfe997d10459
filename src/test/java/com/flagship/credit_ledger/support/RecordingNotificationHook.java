package com.flagship.credit_ledger.support;

import com.flagship.credit_ledger.notification.CreditNotificationHook;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records hook calls as strings such as "issued:&lt;id&gt;"; can be told to fail every call.
 */
public class RecordingNotificationHook implements CreditNotificationHook {

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<String> calls() {
        return calls;
    }

    @Override
    public void onIssued(UUID creditId) {
        record("issued:" + creditId);
    }

    @Override
    public void onExpiring(UUID creditId, int daysUntil) {
        record("expiring:" + creditId + ":" + daysUntil);
    }

    @Override
    public void onRedeemed(UUID creditId, UUID transactionId) {
        record("redeemed:" + creditId + ":" + transactionId);
    }

    private void record(String call) {
        calls.add(call);
        if (failing) {
            throw new IllegalStateException("Notification backend unavailable");
        }
    }
}
