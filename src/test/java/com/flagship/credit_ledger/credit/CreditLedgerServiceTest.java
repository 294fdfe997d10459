package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.event.CreditEvent;
import com.flagship.credit_ledger.credit.exception.AdjustmentOutOfRangeException;
import com.flagship.credit_ledger.credit.exception.AlreadyTerminalException;
import com.flagship.credit_ledger.credit.exception.CreditConcurrentModificationException;
import com.flagship.credit_ledger.credit.exception.CreditLedgerException;
import com.flagship.credit_ledger.credit.exception.CreditNotActiveException;
import com.flagship.credit_ledger.credit.exception.CreditNotFoundException;
import com.flagship.credit_ledger.credit.exception.ErrorKind;
import com.flagship.credit_ledger.credit.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.credit.exception.InvalidAmountException;
import com.flagship.credit_ledger.credit.exception.InvalidExpirationDateException;
import com.flagship.credit_ledger.reporting.ReportingProjection;
import com.flagship.credit_ledger.support.LedgerTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Ledger behaviour end to end through the service facade, on the in-memory store.
 *
 * Covers the balance identity, the status state machine, zero side effects on rejected
 * operations, conflict retries and post-commit notifications.
 */
class CreditLedgerServiceTest {

    private LedgerTestFixture fixture;
    private CreditLedgerService service;

    @BeforeEach
    void setUp() {
        fixture = new LedgerTestFixture();
        service = fixture.service;
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, amount(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    private void assertBalanceIdentity(UUID creditId) {
        Credit credit = service.getCredit(creditId);
        List<CreditTransaction> history = service.getHistory(creditId);
        BigDecimal sum = history.stream().map(CreditTransaction::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        assertEquals(0, sum.compareTo(credit.getBalance()), "balance must equal the sum of entries");
        assertEquals(0, history.get(history.size() - 1).getBalanceAfter().compareTo(credit.getBalance()),
            "latest balanceAfter must equal the balance");
    }

    @Nested
    @DisplayName("Issue")
    class Issue {

        @Test
        @DisplayName("Issue creates an ACTIVE credit with a single ISSUE entry")
        void testIssue_CreatesCreditAndEntry() {
            printTestHeader("Issue - Creates Credit And Entry");

            LedgerResult result = fixture.issue("100.00");

            Credit credit = result.getCredit();
            assertEquals(CreditStatus.ACTIVE, credit.getStatus());
            assertAmount("100.00", credit.getBalance());
            assertTrue(CreditCodeGenerator.isWellFormed(credit.getCode()));

            List<CreditTransaction> history = service.getHistory(credit.getId());
            assertEquals(1, history.size());
            assertEquals(TransactionType.ISSUE, history.get(0).getType());
            assertAmount("100.00", history.get(0).getAmount());
            assertAmount("100.00", history.get(0).getBalanceAfter());
            assertEquals("staff-1", history.get(0).getStaffId());

            verify(fixture.outboxService).saveEvent(eq(CreditEvent.AGGREGATE_TYPE), eq(credit.getId()),
                eq("CreditIssued"), any(CreditEvent.class));
            assertEquals(List.of("issued:" + credit.getId()), fixture.hook.calls());

            printSuccess("Credit issued with balance " + credit.getBalance());
        }

        @Test
        @DisplayName("Invalid issuance writes nothing")
        void testIssue_InvalidInputHasNoSideEffects() {
            printTestHeader("Issue - Invalid Input Has No Side Effects");

            assertThrows(InvalidAmountException.class, () -> fixture.issue("0"));
            assertThrows(InvalidAmountException.class, () -> fixture.issue("-1"));
            assertThrows(InvalidExpirationDateException.class,
                () -> fixture.issue("10", LedgerTestFixture.START.minus(Duration.ofDays(1))));

            assertEquals(0, fixture.store.transactionCount());
            assertTrue(fixture.hook.calls().isEmpty());
            verify(fixture.outboxService, never()).saveEvent(any(), any(), any(), any());

            printSuccess("Rejected issuances left the ledger empty");
        }

        @Test
        @DisplayName("Repeating an issuance with the same idempotency key returns the first credit")
        void testIssue_IdempotencyKey() {
            printTestHeader("Issue - Idempotency Key");

            IssueCreditCommand command = IssueCreditCommand.builder()
                .customerId("cust-9")
                .amount(amount("20"))
                .currency(CurrencyCode.GBP)
                .idempotencyKey("promo-2026-cust-9")
                .build();

            LedgerResult first = service.issue(command);
            LedgerResult second = service.issue(command);

            assertFalse(first.isReplayed());
            assertTrue(second.isReplayed());
            assertEquals(first.getCredit().getId(), second.getCredit().getId());
            assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
            assertEquals(1, fixture.store.transactionCount());
            assertEquals(1, fixture.hook.calls().size(), "replay must not notify again");

            printSuccess("Second request replayed credit " + second.getCredit().getCode());
        }
    }

    @Nested
    @DisplayName("Redeem")
    class Redeem {

        @Test
        @DisplayName("Issue 100, redeem 30, redeem 70: balance 0, USED, three entries")
        void testRedeem_ToZero() {
            printTestHeader("Redeem - To Zero");

            UUID id = fixture.issue("100").getCredit().getId();
            fixture.redeem(id, "30");
            LedgerResult last = fixture.redeem(id, "70");

            assertEquals(CreditStatus.USED, last.getCredit().getStatus());
            assertAmount("0", last.getCredit().getBalance());

            List<CreditTransaction> history = service.getHistory(id);
            assertEquals(List.of(TransactionType.ISSUE, TransactionType.REDEEM, TransactionType.REDEEM),
                history.stream().map(CreditTransaction::getType).toList());
            assertAmount("-30", history.get(1).getAmount());
            assertAmount("70", history.get(1).getBalanceAfter());
            assertAmount("0", history.get(2).getBalanceAfter());
            assertTrue(history.get(1).getSequenceNumber() < history.get(2).getSequenceNumber());
            assertBalanceIdentity(id);

            printSuccess("Credit fully redeemed and USED");
        }

        @Test
        @DisplayName("Redeeming more than the balance fails and leaves the credit untouched")
        void testRedeem_InsufficientBalance() {
            printTestHeader("Redeem - Insufficient Balance");

            UUID id = fixture.issue("50").getCredit().getId();
            Credit before = service.getCredit(id);

            CreditLedgerException e = assertThrows(InsufficientBalanceException.class, () -> fixture.redeem(id, "60"));
            assertEquals(ErrorKind.INSUFFICIENT_BALANCE, e.getKind());

            assertEquals(before, service.getCredit(id));
            assertEquals(1, service.getHistory(id).size());

            printSuccess("Over-redemption rejected with " + e.getKind());
        }

        @Test
        @DisplayName("Redeeming a past-due credit fails before the sweep has expired it")
        void testRedeem_PastDue() {
            printTestHeader("Redeem - Past Due");

            UUID id = fixture.issue("50", LedgerTestFixture.START.plus(Duration.ofDays(1))).getCredit().getId();
            fixture.clock.advance(Duration.ofDays(2));

            assertThrows(CreditNotActiveException.class, () -> fixture.redeem(id, "10"));
            assertEquals(CreditStatus.ACTIVE, service.getCredit(id).getStatus());
            assertEquals(1, service.getHistory(id).size());

            printSuccess("Past-due redemption rejected without side effects");
        }

        @Test
        @DisplayName("Adjusting a past-due credit fails before the sweep has expired it")
        void testAdjust_PastDue() {
            UUID id = fixture.issue("50", LedgerTestFixture.START.plus(Duration.ofDays(1))).getCredit().getId();
            fixture.redeem(id, "20");
            fixture.clock.advance(Duration.ofDays(2));

            assertThrows(CreditNotActiveException.class, () -> service.adjust(id, amount("10"), "Goodwill", "mgr-1"));
            assertThrows(CreditNotActiveException.class, () -> service.adjust(id, amount("-10"), "Damage", "mgr-1"));
            assertAmount("30", service.getCredit(id).getBalance());
            assertEquals(2, service.getHistory(id).size());
        }

        @Test
        @DisplayName("Redeem on an unknown credit is NOT_FOUND")
        void testRedeem_UnknownCredit() {
            CreditLedgerException e = assertThrows(CreditNotFoundException.class,
                () -> fixture.redeem(UUID.randomUUID(), "1"));
            assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("Two concurrent redemptions of 60 against 100: exactly one succeeds")
        void testRedeem_ConcurrentOverdraw() throws Exception {
            printTestHeader("Redeem - Concurrent Overdraw");

            UUID id = fixture.issue("100").getCredit().getId();
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> outcomes = new ArrayList<>();

            try {
                for (int i = 0; i < 2; i++) {
                    outcomes.add(executor.submit(() -> {
                        start.await();
                        try {
                            fixture.redeem(id, "60");
                            return "ok";
                        } catch (CreditLedgerException e) {
                            return e.getKind().name();
                        }
                    }));
                }
                start.countDown();

                List<String> results = new ArrayList<>();
                for (Future<String> outcome : outcomes) {
                    results.add(outcome.get(10, TimeUnit.SECONDS));
                }
                System.out.println("Outcomes: " + results);

                assertEquals(1, results.stream().filter("ok"::equals).count());
                assertEquals(1, results.stream().filter(ErrorKind.INSUFFICIENT_BALANCE.name()::equals).count());
            } finally {
                executor.shutdownNow();
            }

            assertAmount("40", service.getCredit(id).getBalance());
            assertEquals(2, service.getHistory(id).size());
            assertBalanceIdentity(id);

            printSuccess("Balance never went negative");
        }

        @Test
        @DisplayName("Many concurrent small redemptions never overdraw")
        void testRedeem_ManyConcurrent() throws Exception {
            UUID id = fixture.issue("10").getCredit().getId();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> outcomes = new ArrayList<>();

            try {
                for (int i = 0; i < 25; i++) {
                    outcomes.add(executor.submit(() -> {
                        start.await();
                        try {
                            fixture.redeem(id, "1");
                            return true;
                        } catch (CreditLedgerException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();

                int succeeded = 0;
                for (Future<Boolean> outcome : outcomes) {
                    if (outcome.get(10, TimeUnit.SECONDS)) {
                        succeeded++;
                    }
                }
                assertEquals(10, succeeded);
            } finally {
                executor.shutdownNow();
            }

            Credit credit = service.getCredit(id);
            assertEquals(CreditStatus.USED, credit.getStatus());
            assertAmount("0", credit.getBalance());
            assertBalanceIdentity(id);
        }
    }

    @Nested
    @DisplayName("Adjust, cancel and extend")
    class OtherOperations {

        @Test
        @DisplayName("Adjustments move the balance within [0, original]")
        void testAdjust_Range() {
            printTestHeader("Adjust - Range");

            UUID id = fixture.issue("50").getCredit().getId();
            fixture.redeem(id, "20");

            LedgerResult up = service.adjust(id, amount("15"), "Goodwill", "mgr-1");
            assertAmount("45", up.getCredit().getBalance());
            assertEquals("Goodwill", up.getTransaction().getNote());

            assertThrows(AdjustmentOutOfRangeException.class, () -> service.adjust(id, amount("10"), "Too much", "mgr-1"));
            assertThrows(AdjustmentOutOfRangeException.class, () -> service.adjust(id, amount("-46"), "Too little", "mgr-1"));
            assertThrows(InvalidAmountException.class, () -> service.adjust(id, BigDecimal.ZERO, "Nothing", "mgr-1"));
            assertThrows(IllegalArgumentException.class, () -> service.adjust(id, amount("1"), " ", "mgr-1"));

            assertAmount("45", service.getCredit(id).getBalance());
            assertEquals(3, service.getHistory(id).size());
            assertBalanceIdentity(id);

            printSuccess("Out-of-range adjustments rejected");
        }

        @Test
        @DisplayName("Adjustment above the original amount is allowed when enabled")
        void testAdjust_AboveOriginalWhenEnabled() {
            fixture.properties.getAdjust().setAllowAboveOriginal(true);
            UUID id = fixture.issue("50").getCredit().getId();

            LedgerResult result = service.adjust(id, amount("25"), "Loyalty bonus", "mgr-1");

            assertAmount("75", result.getCredit().getBalance());
            assertAmount("50", result.getCredit().getOriginalAmount());
            assertBalanceIdentity(id);
        }

        @Test
        @DisplayName("Cancel writes off the balance and is final")
        void testCancel() {
            printTestHeader("Cancel");

            UUID id = fixture.issue("80").getCredit().getId();
            fixture.redeem(id, "30");

            LedgerResult cancelled = service.cancel(id, "Fraud", "mgr-2");

            assertEquals(CreditStatus.CANCELLED, cancelled.getCredit().getStatus());
            assertAmount("-50", cancelled.getTransaction().getAmount());
            assertAmount("0", cancelled.getTransaction().getBalanceAfter());
            assertBalanceIdentity(id);

            assertThrows(AlreadyTerminalException.class, () -> service.cancel(id, "Again", "mgr-2"));
            assertThrows(CreditNotActiveException.class, () -> fixture.redeem(id, "1"));
            assertThrows(CreditNotActiveException.class, () -> service.adjust(id, amount("1"), "x", "mgr-2"));
            assertEquals(3, service.getHistory(id).size());

            printSuccess("Cancelled credit rejects every further change");
        }

        @Test
        @DisplayName("Extending the expiration appends a zero-amount entry with both dates")
        void testExtendExpiration() {
            printTestHeader("Extend Expiration");

            Instant original = LedgerTestFixture.START.plus(Duration.ofDays(30));
            Instant extended = original.plus(Duration.ofDays(60));
            UUID id = fixture.issue("40", original).getCredit().getId();

            LedgerResult result = service.extendExpiration(id, extended, "Customer request", "mgr-3");

            assertEquals(extended, result.getCredit().getExpirationDate());
            assertAmount("40", result.getCredit().getBalance());
            CreditTransaction tx = result.getTransaction();
            assertEquals(TransactionType.EXTEND_EXPIRATION, tx.getType());
            assertAmount("0", tx.getAmount());
            assertEquals(original.toString(), tx.getMetadata().get("previousExpirationDate"));
            assertEquals(extended.toString(), tx.getMetadata().get("newExpirationDate"));
            assertBalanceIdentity(id);

            assertThrows(InvalidExpirationDateException.class,
                () -> service.extendExpiration(id, original, "Backwards", "mgr-3"));

            printSuccess("Extension recorded in the ledger");
        }
    }

    @Nested
    @DisplayName("Expire")
    class Expire {

        @Test
        @DisplayName("Expire zeroes the remaining balance of a past-due credit")
        void testExpire() {
            Instant expiry = LedgerTestFixture.START.plus(Duration.ofDays(1));
            UUID id = fixture.issue("100", expiry).getCredit().getId();
            fixture.redeem(id, "30");
            fixture.clock.set(expiry.plus(Duration.ofMinutes(5)));

            LedgerResult result = service.expire(id, expiry);

            assertEquals(CreditStatus.EXPIRED, result.getCredit().getStatus());
            assertAmount("-70", result.getTransaction().getAmount());
            assertEquals(fixture.clock.instant(), result.getTransaction().getTimestamp());
            assertEquals(fixture.clock.instant(), result.getCredit().getUpdatedAt());
            assertBalanceIdentity(id);
        }

        @Test
        @DisplayName("A sweep instant older than the last entry does not backdate the EXPIRE entry")
        void testExpire_StaleSweepInstant() {
            printTestHeader("Expire - Stale Sweep Instant");

            Instant expiry = LedgerTestFixture.START.plus(Duration.ofDays(1));
            UUID id = fixture.issue("100", expiry).getCredit().getId();
            fixture.clock.set(expiry.minus(Duration.ofHours(1)));
            fixture.redeem(id, "10");
            fixture.clock.set(expiry.plus(Duration.ofHours(3)));
            Instant updatedBefore = service.getCredit(id).getUpdatedAt();

            LedgerResult result = service.expire(id, expiry.plus(Duration.ofHours(1)));

            assertEquals(expiry.plus(Duration.ofHours(3)), result.getTransaction().getTimestamp());
            assertFalse(result.getCredit().getUpdatedAt().isBefore(updatedBefore));

            List<CreditTransaction> history = service.getHistory(id);
            for (int i = 1; i < history.size(); i++) {
                assertFalse(history.get(i).getTimestamp().isBefore(history.get(i - 1).getTimestamp()),
                    "entry " + i + " is older than the entry before it");
            }

            ReportingProjection projection = new ReportingProjection(fixture.store);
            assertAmount("90", projection.balanceAsOf(id, expiry.plus(Duration.ofHours(2))));
            assertAmount("0", projection.balanceAsOf(id, expiry.plus(Duration.ofHours(3))));

            printSuccess("EXPIRE entry stamped when written");
        }

        @Test
        @DisplayName("Expire before the expiration date is rejected")
        void testExpire_NotDue() {
            UUID id = fixture.issue("100").getCredit().getId();

            assertThrows(InvalidExpirationDateException.class, () -> service.expire(id, LedgerTestFixture.START));
            assertEquals(CreditStatus.ACTIVE, service.getCredit(id).getStatus());
        }
    }

    @Nested
    @DisplayName("Retries and notifications")
    class RetriesAndNotifications {

        @Test
        @DisplayName("Lock conflicts are retried until the operation succeeds")
        void testRetry_ConflictThenSuccess() {
            printTestHeader("Retry - Conflict Then Success");

            UUID id = fixture.issue("100").getCredit().getId();
            fixture.store.failNextLocks(id, 2);

            LedgerResult result = fixture.redeem(id, "10");

            assertAmount("90", result.getCredit().getBalance());
            assertEquals(2.0, fixture.meterRegistry.counter("credit.operation.retries", "operation", "redeem").count());

            printSuccess("Redeem succeeded on the third attempt");
        }

        @Test
        @DisplayName("Conflicts beyond the retry budget surface as CONCURRENT_MODIFICATION")
        void testRetry_Exhausted() {
            UUID id = fixture.issue("100").getCredit().getId();
            fixture.store.failNextLocks(id, 3);

            CreditLedgerException e = assertThrows(CreditConcurrentModificationException.class,
                () -> fixture.redeem(id, "10"));

            assertTrue(e.isRetryable());
            assertAmount("100", service.getCredit(id).getBalance());
        }

        @Test
        @DisplayName("Validation errors are never retried")
        void testRetry_NotForValidationErrors() {
            UUID id = fixture.issue("5").getCredit().getId();

            assertThrows(InsufficientBalanceException.class, () -> fixture.redeem(id, "6"));

            assertEquals(0.0, fixture.meterRegistry.counter("credit.operation.retries", "operation", "redeem").count());
            verify(fixture.outboxService, times(1)).saveEvent(any(), any(), any(), any());
        }

        @Test
        @DisplayName("A failing hook does not fail or undo the operation")
        void testNotification_FailureIsSwallowed() {
            printTestHeader("Notification - Failure Is Swallowed");

            fixture.hook.setFailing(true);

            LedgerResult issued = fixture.issue("30");
            LedgerResult redeemed = fixture.redeem(issued.getCredit().getId(), "10");

            assertAmount("20", service.getCredit(issued.getCredit().getId()).getBalance());
            assertEquals(List.of(
                "issued:" + issued.getCredit().getId(),
                "redeemed:" + issued.getCredit().getId() + ":" + redeemed.getTransaction().getId()),
                fixture.hook.calls());
            assertEquals(1.0, fixture.meterRegistry.counter("credit.notification.failures", "callback", "onIssued").count());

            printSuccess("Ledger committed despite hook failures");
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Lookup by code works and malformed codes are not found")
        void testFindByCode() {
            Credit credit = fixture.issue("10").getCredit();

            assertEquals(credit.getId(), service.getCreditByCode(credit.getCode()).getId());
            assertThrows(CreditNotFoundException.class, () -> service.getCreditByCode("not-a-code"));
        }

        @Test
        @DisplayName("Customer listing hides terminal credits unless asked")
        void testFindCreditsByCustomer() {
            UUID active = fixture.issue("10").getCredit().getId();
            fixture.clock.advance(Duration.ofMinutes(1));
            UUID used = fixture.issue("10").getCredit().getId();
            fixture.redeem(used, "10");

            assertEquals(List.of(active),
                service.findCreditsByCustomer("cust-1", false).stream().map(Credit::getId).toList());
            assertEquals(List.of(used, active),
                service.findCreditsByCustomer("cust-1", true).stream().map(Credit::getId).toList());
        }

        @Test
        @DisplayName("History of an unknown credit is NOT_FOUND")
        void testGetHistory_Unknown() {
            assertThrows(CreditNotFoundException.class, () -> service.getHistory(UUID.randomUUID()));
        }
    }
}
