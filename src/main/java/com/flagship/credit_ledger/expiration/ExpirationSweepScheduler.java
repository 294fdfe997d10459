package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs the expiration sweep daily (03:00 by default).
 */
@Component
@ConditionalOnProperty(name = "credit-ledger.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExpirationSweepScheduler {

    private final ExpirationSweeper sweeper;
    private final CreditMetrics metrics;
    private final Clock clock;

    @Scheduled(cron = "${credit-ledger.sweep.cron:0 0 3 * * *}")
    public void runScheduledSweep() {
        String correlationId = CorrelationContext.generateCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        try {
            Instant started = clock.instant();
            SweepResult result = sweeper.sweepExpired(started);
            metrics.recordSweep(result, Duration.between(started, clock.instant()));

            if (result.hasFailures()) {
                log.warn("Scheduled sweep finished with {} failure(s); first: {}",
                    result.getFailures().size(), result.getFailures().get(0));
            }
        } catch (Exception e) {
            log.error("Scheduled expiration sweep aborted", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
