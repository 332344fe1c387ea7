package villagecompute.dailybrief.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.dailybrief.data.stores.EngagementFactsStore;
import villagecompute.dailybrief.exceptions.DataFetchException;
import villagecompute.dailybrief.services.EngagementBackoffService.BackoffDecision;
import villagecompute.dailybrief.testing.InMemoryEngagementFactsStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Test suite for EngagementBackoffService.
 *
 * <p>
 * Coverage:
 * <ul>
 * <li>Every backoff band and its boundaries</li>
 * <li>Re-engagement pulses gated by the time since the last brief</li>
 * <li>New users and users who never received a brief</li>
 * <li>Fail-open behavior on read errors, single and batch</li>
 * </ul>
 */
class EngagementBackoffServiceTest {

    private static final Instant NOW = Instant.parse("2025-10-01T12:00:00Z");

    private EngagementBackoffService service;
    private InMemoryEngagementFactsStore facts;

    @BeforeEach
    void setUp() {
        facts = new InMemoryEngagementFactsStore();
        service = new EngagementBackoffService();
        service.factsStore = facts;
    }

    private static Instant daysAgo(long days) {
        return NOW.minus(Duration.ofDays(days));
    }

    @Test
    void testActiveBand_alwaysSends() {
        for (int days = 0; days <= 2; days++) {
            BackoffDecision decision = service.decide(days, 0);
            assertTrue(decision.shouldSend(), "Day " + days + " should send");
            assertFalse(decision.isReengagement());
            assertEquals(days, decision.daysSinceLastLogin());
            assertEquals("User is active (logged in within 2 days)", decision.reason());
        }
    }

    @Test
    void testCoolingOff_dayThree_skips() {
        BackoffDecision decision = service.decide(3, EngagementBackoffService.NEVER_NOTIFIED);
        assertFalse(decision.shouldSend());
        assertFalse(decision.isReengagement());
        assertEquals("Cooling off period (3 days inactive)", decision.reason());
    }

    @Test
    void testFirstPulse_dayFour_sendsWhenLastBriefOldEnough() {
        BackoffDecision decision = service.decide(4, 2);
        assertTrue(decision.shouldSend());
        assertTrue(decision.isReengagement());
        assertEquals("4-day re-engagement email", decision.reason());
    }

    @Test
    void testFirstPulse_dayFour_skipsWhenLastBriefRecent() {
        BackoffDecision decision = service.decide(4, 1);
        assertFalse(decision.shouldSend());
        assertFalse(decision.isReengagement());
        assertEquals("4-day re-engagement skipped (last brief 1 day ago)", decision.reason());
    }

    @Test
    void testFirstBackoff_daysFiveToNine_skip() {
        for (int days = 5; days <= 9; days++) {
            BackoffDecision decision = service.decide(days, EngagementBackoffService.NEVER_NOTIFIED);
            assertFalse(decision.shouldSend(), "Day " + days + " should skip");
            assertEquals("First backoff period (5-9 days)", decision.reason());
        }
    }

    @Test
    void testSecondPulse_dayTen_sendsWhenLastBriefSixDaysOld() {
        BackoffDecision decision = service.decide(10, 6);
        assertTrue(decision.shouldSend());
        assertTrue(decision.isReengagement());
        assertEquals(10, decision.daysSinceLastLogin());
        assertEquals("10-day re-engagement email", decision.reason());
    }

    @Test
    void testSecondPulse_dayTen_skipsWhenLastBriefRecent() {
        BackoffDecision decision = service.decide(10, 5);
        assertFalse(decision.shouldSend());
        assertEquals("10-day re-engagement skipped (last brief 5 days ago)", decision.reason());
    }

    @Test
    void testSecondBackoff_daysElevenToThirty_skip() {
        BackoffDecision decision = service.decide(15, 10);
        assertFalse(decision.shouldSend());
        assertFalse(decision.isReengagement());
        assertEquals("Second backoff period (11-30 days)", decision.reason());

        assertFalse(service.decide(11, EngagementBackoffService.NEVER_NOTIFIED).shouldSend());
        assertFalse(service.decide(30, EngagementBackoffService.NEVER_NOTIFIED).shouldSend());
    }

    @Test
    void testRecurring_thirtyOnePlus_sendsEveryThirtyOneDays() {
        BackoffDecision sent = service.decide(45, 31);
        assertTrue(sent.shouldSend());
        assertTrue(sent.isReengagement());
        assertEquals("31+ day re-engagement email (45 days inactive)", sent.reason());

        BackoffDecision waiting = service.decide(45, 30);
        assertFalse(waiting.shouldSend());
        assertEquals("Waiting for 31-day interval (last brief 30 days ago)", waiting.reason());
    }

    @Test
    void testNeverNotified_pulsesSend() {
        assertTrue(service.decide(4, EngagementBackoffService.NEVER_NOTIFIED).shouldSend());
        assertTrue(service.decide(10, EngagementBackoffService.NEVER_NOTIFIED).shouldSend());
        assertTrue(service.decide(31, EngagementBackoffService.NEVER_NOTIFIED).shouldSend());
    }

    @Test
    void testNegativeDays_treatedAsActive() {
        BackoffDecision decision = service.decide(-3, -1);
        assertTrue(decision.shouldSend());
        assertEquals(0, decision.daysSinceLastLogin());
    }

    @Test
    void testBands_exhaustive_onlyPulsesAreReengagement() {
        for (int days = 0; days <= 400; days++) {
            BackoffDecision decision = service.decide(days, EngagementBackoffService.NEVER_NOTIFIED);
            assertNotNull(decision.reason());
            if (decision.isReengagement()) {
                assertTrue(decision.shouldSend(), "Re-engagement must imply send on day " + days);
                assertTrue(days == 4 || days == 10 || days >= 31, "Unexpected pulse on day " + days);
            }
        }
    }

    @Test
    void testEvaluate_noRecordedVisit_treatedAsNewUser() {
        BackoffDecision decision = service.evaluate(UUID.randomUUID(), NOW);
        assertTrue(decision.shouldSend());
        assertFalse(decision.isReengagement());
        assertEquals(0, decision.daysSinceLastLogin());
        assertEquals(EngagementBackoffService.REASON_NO_LAST_VISIT, decision.reason());
    }

    @Test
    void testEvaluate_usesWholeDays() {
        UUID userId = UUID.randomUUID();
        // 3 days 23 hours is still day 3
        facts.setLastActivity(userId, NOW.minus(Duration.ofHours(95)));

        BackoffDecision decision = service.evaluate(userId, NOW);

        assertFalse(decision.shouldSend());
        assertEquals(3, decision.daysSinceLastLogin());
    }

    @Test
    void testEvaluate_dayFourWithOldBrief_sendsReengagement() {
        UUID userId = UUID.randomUUID();
        facts.setLastActivity(userId, daysAgo(4));
        facts.setLastNotification(userId, daysAgo(3));

        BackoffDecision decision = service.evaluate(userId, NOW);

        assertTrue(decision.shouldSend());
        assertTrue(decision.isReengagement());
        assertEquals(4, decision.daysSinceLastLogin());
    }

    @Test
    void testEvaluate_futureVisit_clampedToZero() {
        UUID userId = UUID.randomUUID();
        facts.setLastActivity(userId, NOW.plus(Duration.ofHours(5)));

        BackoffDecision decision = service.evaluate(userId, NOW);

        assertTrue(decision.shouldSend());
        assertEquals(0, decision.daysSinceLastLogin());
    }

    @Test
    void testEvaluate_readFailure_failsOpen() {
        EngagementFactsStore failing = mock(EngagementFactsStore.class);
        when(failing.getLastActivity(any())).thenThrow(new DataFetchException("connection refused"));
        service.factsStore = failing;

        BackoffDecision decision = service.evaluate(UUID.randomUUID(), NOW);

        assertTrue(decision.shouldSend(), "Read failures must never suppress a brief");
        assertFalse(decision.isReengagement());
        assertEquals(EngagementBackoffService.REASON_FAIL_OPEN, decision.reason());
    }

    @Test
    void testEvaluateBatch_usesTwoBulkReads() {
        UUID active = UUID.randomUUID();
        UUID dormant = UUID.randomUUID();
        UUID fresh = UUID.randomUUID();
        facts.setLastActivity(active, daysAgo(1));
        facts.setLastActivity(dormant, daysAgo(15));
        facts.setLastNotification(dormant, daysAgo(10));

        Map<UUID, BackoffDecision> decisions = service.evaluateBatch(List.of(active, dormant, fresh), NOW);

        assertEquals(2, facts.getBatchCalls());
        assertEquals(0, facts.getSingleCalls());
        assertEquals(List.of(active, dormant, fresh), List.copyOf(decisions.keySet()));
        assertTrue(decisions.get(active).shouldSend());
        assertFalse(decisions.get(dormant).shouldSend());
        assertEquals("Second backoff period (11-30 days)", decisions.get(dormant).reason());
        assertEquals(EngagementBackoffService.REASON_NO_LAST_VISIT, decisions.get(fresh).reason());
    }

    @Test
    void testEvaluateBatch_bulkFailure_fallsBackPerUser() {
        UUID dormant = UUID.randomUUID();
        facts.setLastActivity(dormant, daysAgo(7));
        facts.failBatch();

        Map<UUID, BackoffDecision> decisions = service.evaluateBatch(List.of(dormant), NOW);

        assertTrue(facts.getSingleCalls() > 0, "Expected per-user fallback reads");
        assertFalse(decisions.get(dormant).shouldSend());
        assertEquals("First backoff period (5-9 days)", decisions.get(dormant).reason());
    }

    @Test
    void testEvaluateBatch_empty_returnsEmpty() {
        assertTrue(service.evaluateBatch(List.of(), NOW).isEmpty());
        assertEquals(0, facts.getBatchCalls());
    }
}
