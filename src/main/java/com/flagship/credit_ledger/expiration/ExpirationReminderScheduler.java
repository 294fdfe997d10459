package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@ConditionalOnProperty(name = "credit-ledger.reminders.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExpirationReminderScheduler {

    private final ExpirationReminderService reminderService;
    private final CreditLedgerProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${credit-ledger.reminders.cron:0 0 9 * * *}")
    public void sendDailyReminders() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            Instant now = clock.instant();
            for (Integer days : properties.getReminders().getDays()) {
                try {
                    reminderService.sendReminders(now, days);
                } catch (Exception e) {
                    log.error("Expiration reminders for {} day(s) failed", days, e);
                }
            }
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
