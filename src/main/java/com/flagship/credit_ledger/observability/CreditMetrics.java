package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.credit.CreditStatus;
import com.flagship.credit_ledger.expiration.SweepResult;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for credit operations.
 *
 * <ul>
 *   <li>credit.operations{operation, outcome}: completed operations, outcome is "success" or the error kind</li>
 *   <li>credit.operation.duration{operation}: latency including retries</li>
 *   <li>credit.operation.retries{operation}: conflict retries</li>
 *   <li>credit.amount{operation, currency}: absolute amounts moved</li>
 *   <li>credit.count{status}: credits per status, refreshed by {@link MetricsScheduler}</li>
 *   <li>credit.sweep.*, credit.reminders.sent, credit.notification.failures</li>
 * </ul>
 */
@Component
public class CreditMetrics {

    private final MeterRegistry registry;
    private final Map<CreditStatus, AtomicLong> creditsByStatus = new EnumMap<>(CreditStatus.class);

    public CreditMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (CreditStatus status : CreditStatus.values()) {
            AtomicLong holder = new AtomicLong(0);
            creditsByStatus.put(status, holder);
            Gauge.builder("credit.count", holder, AtomicLong::get)
                    .description("Number of credits per status")
                    .tag("status", status.name())
                    .register(registry);
        }
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("credit.operations",
                "operation", operation,
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("credit.operation.duration", "operation", operation).record(duration);
    }

    public void recordRetry(String operation) {
        registry.counter("credit.operation.retries", "operation", operation).increment();
    }

    public void recordAmount(String operation, String currency, BigDecimal amount) {
        DistributionSummary.builder("credit.amount")
                .description("Absolute amount moved per operation")
                .tag("operation", operation)
                .tag("currency", sanitizeTag(currency))
                .register(registry)
                .record(amount.abs().doubleValue());
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordSweep(SweepResult result, Duration duration) {
        registry.counter("credit.sweep.expired").increment(result.getExpiredCount());
        registry.counter("credit.sweep.skipped").increment(result.getSkippedCount());
        registry.counter("credit.sweep.failed").increment(result.getFailures().size());
        registry.timer("credit.sweep.duration").record(duration);
    }

    public void recordRemindersSent(int daysUntil, int count) {
        registry.counter("credit.reminders.sent", "days", String.valueOf(daysUntil)).increment(count);
    }

    public void recordNotificationFailure(String callback) {
        registry.counter("credit.notification.failures", "callback", callback).increment();
    }

    public void updateStatusCounts(Map<CreditStatus, Long> counts) {
        counts.forEach((status, count) -> creditsByStatus.get(status).set(count));
    }

    // Keeps tag cardinality bounded
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
