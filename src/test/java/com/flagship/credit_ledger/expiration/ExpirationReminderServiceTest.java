package com.flagship.credit_ledger.expiration;

import com.flagship.credit_ledger.support.LedgerTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExpirationReminderServiceTest {

    private static final Instant NOW = LedgerTestFixture.START;

    private LedgerTestFixture fixture;
    private ExpirationReminderService reminderService;

    @BeforeEach
    void setUp() {
        fixture = new LedgerTestFixture();
        reminderService = new ExpirationReminderService(fixture.store, fixture.dispatcher, fixture.metrics);
    }

    private UUID issueExpiringIn(Duration fromNow) {
        UUID id = fixture.issue("10", NOW.plus(fromNow)).getCredit().getId();
        fixture.hook.calls().clear();
        return id;
    }

    @Test
    @DisplayName("The 7-day window is (now+6d, now+7d]")
    void testWindowEdges() {
        UUID exactlySeven = issueExpiringIn(Duration.ofDays(7));
        UUID justInside = issueExpiringIn(Duration.ofDays(6).plusSeconds(1));
        issueExpiringIn(Duration.ofDays(6));
        issueExpiringIn(Duration.ofDays(7).plusSeconds(1));

        ReminderResult result = reminderService.sendReminders(NOW, 7);

        assertEquals(2, result.getCandidates());
        assertEquals(2, result.getSent());
        assertEquals(List.of("expiring:" + justInside + ":7", "expiring:" + exactlySeven + ":7"), fixture.hook.calls());
        assertEquals(2.0, fixture.meterRegistry.counter("credit.reminders.sent", "days", "7").count());
    }

    @Test
    @DisplayName("Credits with no balance left are not reminded")
    void testSkipsUsedCredits() {
        UUID used = issueExpiringIn(Duration.ofDays(1));
        fixture.redeem(used, "10");
        fixture.hook.calls().clear();

        ReminderResult result = reminderService.sendReminders(NOW, 1);

        assertEquals(0, result.getCandidates());
        assertTrue(fixture.hook.calls().isEmpty());
    }

    @Test
    @DisplayName("Hook failures are counted, not thrown")
    void testHookFailures() {
        issueExpiringIn(Duration.ofDays(30));
        fixture.hook.setFailing(true);

        ReminderResult result = reminderService.sendReminders(NOW, 30);

        assertEquals(1, result.getCandidates());
        assertEquals(0, result.getSent());
        assertEquals(1, result.getFailed());
    }

    @Test
    @DisplayName("daysUntil below one is rejected")
    void testInvalidDays() {
        assertThrows(IllegalArgumentException.class, () -> reminderService.sendReminders(NOW, 0));
    }
}
