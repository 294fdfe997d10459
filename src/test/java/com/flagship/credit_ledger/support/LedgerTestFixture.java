package com.flagship.credit_ledger.support;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.CreditCodeGenerator;
import com.flagship.credit_ledger.credit.CreditLedgerService;
import com.flagship.credit_ledger.credit.CreditLifecycleEngine;
import com.flagship.credit_ledger.credit.CurrencyCode;
import com.flagship.credit_ledger.credit.IdempotencyService;
import com.flagship.credit_ledger.credit.IssueCreditCommand;
import com.flagship.credit_ledger.credit.LedgerResult;
import com.flagship.credit_ledger.credit.RedeemCreditCommand;
import com.flagship.credit_ledger.ledger.InMemoryLedgerStore;
import com.flagship.credit_ledger.notification.NotificationDispatcher;
import com.flagship.credit_ledger.observability.CreditMetrics;
import com.flagship.credit_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.mock;

/**
 * The real engine and service wired to an in-memory store, a mutable clock and a mocked
 * outbox. Build a fresh one per test.
 */
public class LedgerTestFixture {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final CreditLedgerProperties properties = new CreditLedgerProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final CreditMetrics metrics = new CreditMetrics(meterRegistry);
    public final OutboxService outboxService = mock(OutboxService.class);
    public final RecordingNotificationHook hook = new RecordingNotificationHook();
    public final NotificationDispatcher dispatcher = new NotificationDispatcher(hook, metrics);
    public final CreditCodeGenerator codeGenerator;
    public final CreditLifecycleEngine engine;
    public final CreditLedgerService service;

    public LedgerTestFixture() {
        properties.getRetry().setBackoff(Duration.ZERO);
        codeGenerator = new CreditCodeGenerator(store, clock, properties);
        engine = new CreditLifecycleEngine(store, codeGenerator, outboxService, properties, clock);
        service = new CreditLedgerService(engine, new IdempotencyService(store, Optional.empty()),
            dispatcher, metrics, properties);
    }

    public LedgerResult issue(String amount) {
        return issue(amount, START.plus(Duration.ofDays(30)));
    }

    public LedgerResult issue(String amount, Instant expirationDate) {
        return service.issue(IssueCreditCommand.builder()
            .customerId("cust-1")
            .amount(new BigDecimal(amount))
            .currency(CurrencyCode.USD)
            .expirationDate(expirationDate)
            .staffId("staff-1")
            .locationId("store-1")
            .build());
    }

    public LedgerResult redeem(UUID creditId, String amount) {
        return service.redeem(RedeemCreditCommand.builder()
            .creditId(creditId)
            .amount(new BigDecimal(amount))
            .staffId("staff-2")
            .locationId("store-1")
            .build());
    }
}
