package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BudgetTrackerTest {

    private BudgetTracker tracker;

    @BeforeEach
    void setUp() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getBudget().setDefaultCeiling(10.0);
        properties.getBudget().setSoftThresholdRatio(0.5);
        tracker = new BudgetTracker(properties);
    }

    @Test
    void shouldTrackSpendAndRemaining() {
        tracker.charge("c1", 3.0);
        tracker.charge("c1", 1.5);

        assertEquals(4.5, tracker.spent("c1"), 1e-9);
        assertEquals(5.5, tracker.remaining("c1"), 1e-9);
        assertEquals(10.0, tracker.ceiling("c1"), 1e-9);
        assertFalse(tracker.isBlocked("c1"));
    }

    @Test
    void shouldReportSoftLimit() {
        tracker.charge("c1", 4.0);
        assertFalse(tracker.isSoftLimitReached("c1"));

        tracker.charge("c1", 1.0);
        assertTrue(tracker.isSoftLimitReached("c1"));
    }

    @Test
    void shouldBlockWhenCeilingReached() {
        assertFalse(tracker.charge("c1", 9.0));
        assertTrue(tracker.charge("c1", 1.0));

        assertTrue(tracker.isBlocked("c1"));
        // already blocked, no second transition
        assertFalse(tracker.charge("c1", 1.0));
    }

    @Test
    void shouldRejectNegativeCharge() {
        assertThrows(IllegalArgumentException.class, () -> tracker.charge("c1", -1.0));
    }

    @Test
    void shouldKeepBudgetsSeparatePerConversation() {
        tracker.charge("c1", 10.0);

        assertTrue(tracker.isBlocked("c1"));
        assertFalse(tracker.isBlocked("c2"));
        assertEquals(10.0, tracker.remaining("c2"), 1e-9);
    }

    @Test
    void shouldUnblockOnResetWithNewCeiling() {
        tracker.charge("c1", 10.0);

        assertTrue(tracker.reset("c1", 20.0));

        assertFalse(tracker.isBlocked("c1"));
        assertEquals(0.0, tracker.spent("c1"), 1e-9);
        assertEquals(20.0, tracker.ceiling("c1"), 1e-9);
        assertFalse(tracker.reset("c1", null));
        assertEquals(20.0, tracker.ceiling("c1"), 1e-9);
    }

    @Test
    void shouldResetAllAndReturnBlockedConversations() {
        tracker.charge("c1", 10.0);
        tracker.charge("c2", 2.0);

        List<String> unblocked = tracker.resetAll();

        assertEquals(List.of("c1"), unblocked);
        assertEquals(0.0, tracker.spent("c2"), 1e-9);
        assertFalse(tracker.isBlocked("c1"));
    }

    // ==================== Bounds ====================

    @Test
    void shouldForgetLeastRecentlyChargedBudgetBeyondLimit() {
        tracker.charge("old", 4.0);
        tracker.charge("recent", 4.0);
        for (int i = 0; i < BudgetTracker.MAX_BUDGETS; i++) {
            if (i == BudgetTracker.MAX_BUDGETS / 2) {
                tracker.charge("recent", 1.0);
            }
            tracker.charge("c" + i, 1.0);
        }

        assertEquals(BudgetTracker.MAX_BUDGETS, tracker.trackedCount());
        assertEquals(5.0, tracker.spent("recent"), 1e-9);
        assertEquals(0.0, tracker.spent("old"), 1e-9);
    }

    @Test
    void shouldKeepBlockedBudgetBeyondLimit() {
        tracker.charge("blocked", 10.0);
        for (int i = 0; i < BudgetTracker.MAX_BUDGETS; i++) {
            tracker.charge("c" + i, 1.0);
        }

        assertTrue(tracker.isBlocked("blocked"));
        assertEquals(BudgetTracker.MAX_BUDGETS + 1, tracker.trackedCount());
    }
}
