package ai.letitride.bankroll;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class BankrollTrackerTest {

    @Test
    void drawdownIsMeasuredFromThePeak() {
        BankrollTracker tracker = new BankrollTracker(1000);
        tracker.applyResult(200);   // 1200, new peak
        tracker.applyResult(-500);  // 700, drawdown 500
        tracker.applyResult(300);   // 1000
        tracker.applyResult(400);   // 1400, new peak
        tracker.applyResult(-100);  // 1300, drawdown 100

        assertEquals(1300, tracker.getBalance());
        assertEquals(1400, tracker.getPeak());
        assertEquals(500, tracker.getMaxDrawdown());
        assertEquals(500.0 / 1200.0 * 100.0, tracker.getMaxDrawdownPct(), 1e-9);
        assertEquals(100, tracker.getCurrentDrawdown());
        assertEquals(300, tracker.getSessionProfit());
    }

    @Test
    void peakNeverDropsBelowStart() {
        BankrollTracker tracker = new BankrollTracker(500);
        tracker.applyResult(-50);
        tracker.applyResult(-25);
        assertEquals(500, tracker.getPeak());
        assertEquals(75, tracker.getMaxDrawdown());
        assertEquals(15.0, tracker.getMaxDrawdownPct(), 1e-9);
    }

    @Test
    void historyIsOptIn() {
        BankrollTracker quiet = new BankrollTracker(100);
        quiet.applyResult(10);
        assertTrue(quiet.getHistory().isEmpty());
        assertFalse(quiet.isTrackingHistory());

        BankrollTracker recorded = new BankrollTracker(100, true);
        recorded.applyResult(10);
        recorded.applyResult(-30);
        assertEquals(List.of(110.0, 80.0), recorded.getHistory());
    }

    @Test
    void zeroPeakGivesZeroPercent() {
        BankrollTracker tracker = new BankrollTracker(0);
        tracker.applyResult(-10);
        assertEquals(10, tracker.getMaxDrawdown());
        assertEquals(0.0, tracker.getMaxDrawdownPct());
    }

    @Test
    void negativeStartIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BankrollTracker(-1));
    }
}
