package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.exception.AdjustmentOutOfRangeException;
import com.flagship.credit_ledger.credit.exception.AlreadyTerminalException;
import com.flagship.credit_ledger.credit.exception.CreditNotActiveException;
import com.flagship.credit_ledger.credit.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.credit.exception.InvalidAmountException;
import com.flagship.credit_ledger.credit.exception.InvalidExpirationDateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine and balance rules of the Credit domain object.
 */
class CreditTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Instant IN_30_DAYS = NOW.plus(Duration.ofDays(30));

    private Credit active(String amount) {
        return Credit.issue(UUID.randomUUID(), "SC-TEST0001-AAA", new BigDecimal(amount), CurrencyCode.USD,
            IN_30_DAYS, "cust-1", null, NOW);
    }

    @Nested
    @DisplayName("Issue")
    class Issue {

        @Test
        @DisplayName("New credit is ACTIVE with balance equal to the original amount")
        void testIssue_CreatesActiveCredit() {
            Credit credit = active("100.00");

            assertEquals(CreditStatus.ACTIVE, credit.getStatus());
            assertEquals(0, new BigDecimal("100.00").compareTo(credit.getBalance()));
            assertEquals(credit.getOriginalAmount(), credit.getBalance());
            assertEquals(0L, credit.getVersion());
        }

        @Test
        @DisplayName("Zero and negative amounts are rejected")
        void testIssue_NonPositiveAmount() {
            assertThrows(InvalidAmountException.class, () -> active("0"));
            assertThrows(InvalidAmountException.class, () -> active("-5"));
        }

        @Test
        @DisplayName("Expiration date must be in the future")
        void testIssue_PastExpiration() {
            assertThrows(InvalidExpirationDateException.class, () -> Credit.issue(UUID.randomUUID(), "SC-X",
                BigDecimal.TEN, CurrencyCode.USD, NOW, null, null, NOW));
        }

        @Test
        @DisplayName("A credit may be issued without an expiration date")
        void testIssue_NoExpiration() {
            Credit credit = Credit.issue(UUID.randomUUID(), "SC-X", BigDecimal.TEN, CurrencyCode.EUR, null, null, null, NOW);
            assertNull(credit.getExpirationDate());
            assertFalse(credit.isPastExpiration(NOW.plus(Duration.ofDays(10_000))));
        }
    }

    @Nested
    @DisplayName("Redeem")
    class Redeem {

        @Test
        @DisplayName("Partial redemption keeps the credit ACTIVE")
        void testRedeem_Partial() {
            Credit after = active("100").redeem(new BigDecimal("30"), NOW);

            assertEquals(0, new BigDecimal("70").compareTo(after.getBalance()));
            assertEquals(CreditStatus.ACTIVE, after.getStatus());
        }

        @Test
        @DisplayName("Redeeming the full balance moves the credit to USED")
        void testRedeem_FullBalance() {
            Credit after = active("100").redeem(new BigDecimal("100"), NOW);

            assertEquals(0, after.getBalance().signum());
            assertEquals(CreditStatus.USED, after.getStatus());
            assertTrue(after.isTerminal());
        }

        @Test
        @DisplayName("Redeeming more than the balance fails")
        void testRedeem_Insufficient() {
            assertThrows(InsufficientBalanceException.class, () -> active("100").redeem(new BigDecimal("100.01"), NOW));
        }

        @Test
        @DisplayName("Redeeming a past-due credit fails even while it is still ACTIVE")
        void testRedeem_PastExpiration() {
            Credit credit = active("100");
            assertThrows(CreditNotActiveException.class, () -> credit.redeem(BigDecimal.ONE, IN_30_DAYS));
        }

        @Test
        @DisplayName("Terminal credits cannot be redeemed")
        void testRedeem_Terminal() {
            Credit cancelled = active("100").cancel(NOW);
            assertThrows(CreditNotActiveException.class, () -> cancelled.redeem(BigDecimal.ONE, NOW));
        }
    }

    @Nested
    @DisplayName("Adjust")
    class Adjust {

        @Test
        @DisplayName("Downward adjustment to zero moves the credit to USED")
        void testAdjust_DownToZero() {
            Credit after = active("40").adjust(new BigDecimal("-40"), false, NOW);
            assertEquals(CreditStatus.USED, after.getStatus());
        }

        @Test
        @DisplayName("Adjustment below zero is out of range")
        void testAdjust_BelowZero() {
            assertThrows(AdjustmentOutOfRangeException.class,
                () -> active("40").adjust(new BigDecimal("-40.01"), false, NOW));
        }

        @Test
        @DisplayName("Adjustment above the original amount depends on the toggle")
        void testAdjust_AboveOriginal() {
            Credit redeemed = active("50").redeem(new BigDecimal("10"), NOW);

            assertThrows(AdjustmentOutOfRangeException.class, () -> redeemed.adjust(new BigDecimal("20"), false, NOW));
            Credit raised = redeemed.adjust(new BigDecimal("20"), true, NOW);
            assertEquals(0, new BigDecimal("60").compareTo(raised.getBalance()));
        }

        @Test
        @DisplayName("Zero adjustment is rejected")
        void testAdjust_Zero() {
            assertThrows(InvalidAmountException.class, () -> active("50").adjust(BigDecimal.ZERO, false, NOW));
        }
    }

    @Nested
    @DisplayName("Cancel, expire and extend")
    class Terminal {

        @Test
        @DisplayName("Cancel zeroes the balance and cannot be repeated")
        void testCancel() {
            Credit cancelled = active("25").cancel(NOW);

            assertEquals(CreditStatus.CANCELLED, cancelled.getStatus());
            assertEquals(0, cancelled.getBalance().signum());
            assertThrows(AlreadyTerminalException.class, () -> cancelled.cancel(NOW));
        }

        @Test
        @DisplayName("Expire requires the expiration date to have passed")
        void testExpire() {
            Credit credit = active("25");

            assertThrows(InvalidExpirationDateException.class, () -> credit.expire(NOW, NOW));
            Instant writtenAt = IN_30_DAYS.plus(Duration.ofHours(2));
            Credit expired = credit.expire(IN_30_DAYS, writtenAt);
            assertEquals(CreditStatus.EXPIRED, expired.getStatus());
            assertEquals(0, expired.getBalance().signum());
            assertEquals(writtenAt, expired.getUpdatedAt());
            assertThrows(AlreadyTerminalException.class, () -> expired.expire(IN_30_DAYS, writtenAt));
        }

        @Test
        @DisplayName("Adjustment is rejected once the expiration date has passed")
        void testAdjustPastExpiration() {
            Credit credit = active("25");

            assertThrows(CreditNotActiveException.class, () -> credit.adjust(BigDecimal.ONE, true, IN_30_DAYS));
            assertThrows(CreditNotActiveException.class, () -> credit.adjust(BigDecimal.ONE.negate(), false, IN_30_DAYS));
        }

        @Test
        @DisplayName("Extension must move the date later and keeps the balance")
        void testExtendExpiration() {
            Credit credit = active("25");

            Credit extended = credit.extendExpiration(IN_30_DAYS.plus(Duration.ofDays(30)), NOW);
            assertEquals(IN_30_DAYS.plus(Duration.ofDays(30)), extended.getExpirationDate());
            assertEquals(credit.getBalance(), extended.getBalance());

            assertThrows(InvalidExpirationDateException.class,
                () -> credit.extendExpiration(IN_30_DAYS.minus(Duration.ofDays(1)), NOW));
        }

        @Test
        @DisplayName("No transition leaves a terminal state")
        void testTerminalStatesAreFinal() {
            Credit used = active("10").redeem(BigDecimal.TEN, NOW);

            for (CreditStatus target : CreditStatus.values()) {
                if (target != CreditStatus.USED) {
                    assertFalse(used.canTransitionTo(target), "USED -> " + target);
                }
            }
            assertThrows(CreditNotActiveException.class, () -> used.adjust(BigDecimal.ONE, true, NOW));
            assertThrows(CreditNotActiveException.class,
                () -> used.extendExpiration(IN_30_DAYS.plus(Duration.ofDays(1)), NOW));
        }
    }
}
