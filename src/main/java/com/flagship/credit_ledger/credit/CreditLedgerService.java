package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.exception.CreditLedgerException;
import com.flagship.credit_ledger.credit.exception.CreditNotFoundException;
import com.flagship.credit_ledger.notification.NotificationDispatcher;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every credit operation: the REST API, the jobs and the expiration sweep
 * all come through here.
 *
 * Each attempt runs one {@link CreditLifecycleEngine} transaction. Lock conflicts
 * ({@link com.flagship.credit_ledger.credit.exception.ErrorKind#CONCURRENT_MODIFICATION})
 * are retried up to {@code credit-ledger.retry.max-attempts} times with a linear backoff;
 * every other failure is rethrown immediately. Notifications are dispatched only after the
 * transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedgerService {

    private final CreditLifecycleEngine engine;
    private final IdempotencyService idempotencyService;
    private final NotificationDispatcher notificationDispatcher;
    private final CreditMetrics metrics;
    private final CreditLedgerProperties properties;

    public LedgerResult issue(IssueCreditCommand command) {
        String key = command.getIdempotencyKey();
        if (key != null) {
            Optional<UUID> existing = idempotencyService.findCreditId(key);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key {} already used by credit {}", key, existing.get());
                return execute("issue", existing.get(), () -> engine.issue(command));
            }
            metrics.recordIdempotencyMiss();
        }

        LedgerResult result = execute("issue", null, () -> engine.issue(command));
        if (key != null) {
            idempotencyService.remember(key, result.getCredit().getId());
        }
        return result;
    }

    public LedgerResult redeem(RedeemCreditCommand command) {
        return execute("redeem", command.getCreditId(), () -> engine.redeem(command));
    }

    public LedgerResult adjust(UUID creditId, BigDecimal delta, String reason, String staffId) {
        return execute("adjust", creditId, () -> engine.adjust(creditId, delta, reason, staffId));
    }

    public LedgerResult cancel(UUID creditId, String reason, String staffId) {
        return execute("cancel", creditId, () -> engine.cancel(creditId, reason, staffId));
    }

    public LedgerResult extendExpiration(UUID creditId, Instant newExpirationDate, String reason, String staffId) {
        return execute("extend", creditId, () -> engine.extendExpiration(creditId, newExpirationDate, reason, staffId));
    }

    public LedgerResult expire(UUID creditId, Instant asOf) {
        return execute("expire", creditId, () -> engine.expire(creditId, asOf));
    }

    public Credit getCredit(UUID creditId) {
        return engine.getCredit(creditId);
    }

    public Credit getCreditByCode(String code) {
        return engine.findByCode(code)
            .orElseThrow(() -> new CreditNotFoundException("Credit not found for code: " + code));
    }

    public List<CreditTransaction> getHistory(UUID creditId) {
        return engine.getHistory(creditId);
    }

    public List<Credit> findCreditsByCustomer(String customerId, boolean includeTerminal) {
        return engine.findCreditsByCustomer(customerId, includeTerminal);
    }

    private LedgerResult execute(String operation, UUID creditId, Supplier<LedgerResult> attempt) {
        int maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        long startNanos = System.nanoTime();
        if (creditId != null) {
            MDC.put(CorrelationContext.CREDIT_ID_MDC_KEY, creditId.toString());
        }

        try {
            for (int attemptNo = 1; ; attemptNo++) {
                try {
                    LedgerResult result = attempt.get();
                    metrics.recordOperation(operation, "success");
                    if (!result.isReplayed()) {
                        metrics.recordAmount(operation, result.getCredit().getCurrency().name(),
                            result.getTransaction().getAmount());
                    }
                    notificationDispatcher.dispatch(result);
                    return result;
                } catch (CreditLedgerException e) {
                    if (!e.isRetryable() || attemptNo >= maxAttempts) {
                        metrics.recordOperation(operation, e.getKind().name().toLowerCase());
                        log.warn("Credit {} failed: kind={}, attempts={}, message={}",
                            operation, e.getKind(), attemptNo, e.getMessage());
                        throw e;
                    }
                    metrics.recordRetry(operation);
                    log.info("Credit {} hit a conflict on attempt {}/{}, retrying: {}",
                        operation, attemptNo, maxAttempts, e.getMessage());
                    backoff(attemptNo, e);
                }
            }
        } finally {
            metrics.recordLatency(operation, Duration.ofNanos(System.nanoTime() - startNanos));
            MDC.remove(CorrelationContext.CREDIT_ID_MDC_KEY);
        }
    }

    private void backoff(int attemptNo, CreditLedgerException cause) {
        long delayMs = properties.getRetry().getBackoff().toMillis() * attemptNo;
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
