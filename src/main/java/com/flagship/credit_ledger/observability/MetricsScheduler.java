package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final CreditMetrics creditMetrics;
    private final LedgerStore ledgerStore;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshCreditMetrics() {
        try {
            creditMetrics.updateStatusCounts(ledgerStore.countByStatus());
        } catch (Exception e) {
            log.warn("Failed to refresh credit metrics: {}", e.getMessage());
        }
    }
}
