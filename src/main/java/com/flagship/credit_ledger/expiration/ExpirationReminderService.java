package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.ledger.LedgerStore;
import com.flagship.credit_ledger.notification.NotificationDispatcher;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sends "your credit expires soon" notifications.
 *
 * A run for daysUntil = N picks ACTIVE credits with a positive balance whose expiration
 * date falls in (now + N - 1 days, now + N days]. Daily runs therefore notify each credit
 * exactly once per threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpirationReminderService {

    private final LedgerStore ledgerStore;
    private final NotificationDispatcher dispatcher;
    private final CreditMetrics metrics;

    public ReminderResult sendReminders(Instant now, int daysUntil) {
        if (daysUntil < 1) {
            throw new IllegalArgumentException("daysUntil must be at least 1, got " + daysUntil);
        }
        Instant windowEnd = now.plus(Duration.ofDays(daysUntil));
        Instant windowStart = windowEnd.minus(Duration.ofDays(1));

        List<Credit> expiring = ledgerStore.findActiveExpiringBetween(windowStart, windowEnd);
        int sent = 0;
        for (Credit credit : expiring) {
            if (dispatcher.notifyExpiring(credit.getId(), daysUntil)) {
                sent++;
            }
        }

        metrics.recordRemindersSent(daysUntil, sent);
        log.info("Expiration reminders for {} day(s): candidates={}, sent={}", daysUntil, expiring.size(), sent);
        return new ReminderResult(daysUntil, expiring.size(), sent);
    }
}
