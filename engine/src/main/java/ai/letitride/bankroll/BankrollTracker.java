package ai.letitride.bankroll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks a bankroll through a session: balance, high-water mark and the largest peak-to-trough drop.
 * <p>
 * Per-hand history costs memory on long runs, so it is only kept when asked for.
 */
public class BankrollTracker {
    private final double startingAmount;
    private final boolean trackHistory;
    private final List<Double> history;

    private double balance;
    private double peak;
    private double maxDrawdown;
    private double peakAtMaxDrawdown;

    public BankrollTracker(double startingAmount) {
        this(startingAmount, false);
    }

    /**
     * @param startingAmount opening balance (non-negative)
     * @param trackHistory   record the balance after every result
     * @throws IllegalArgumentException if the starting amount is negative
     */
    public BankrollTracker(double startingAmount, boolean trackHistory) {
        if (startingAmount < 0) {
            throw new IllegalArgumentException("Starting amount cannot be negative, got " + startingAmount);
        }
        this.startingAmount = startingAmount;
        this.trackHistory = trackHistory;
        this.history = trackHistory ? new ArrayList<>() : Collections.emptyList();
        this.balance = startingAmount;
        this.peak = startingAmount;
        this.peakAtMaxDrawdown = startingAmount;
    }

    /**
     * Applies the net result of a hand (positive won, negative lost).
     */
    public void applyResult(double amount) {
        balance += amount;
        if (trackHistory) {
            history.add(balance);
        }
        if (balance > peak) {
            peak = balance;
        }
        double drawdown = peak - balance;
        if (drawdown > maxDrawdown) {
            maxDrawdown = drawdown;
            peakAtMaxDrawdown = peak;
        }
    }

    public double getStartingAmount() {
        return startingAmount;
    }

    public double getBalance() {
        return balance;
    }

    public double getPeak() {
        return peak;
    }

    public double getMaxDrawdown() {
        return maxDrawdown;
    }

    /**
     * Largest drawdown as a percentage of the peak it fell from; 0 when that peak was 0.
     */
    public double getMaxDrawdownPct() {
        if (peakAtMaxDrawdown <= 0) {
            return 0.0;
        }
        return maxDrawdown / peakAtMaxDrawdown * 100.0;
    }

    public double getCurrentDrawdown() {
        return Math.max(0.0, peak - balance);
    }

    public double getSessionProfit() {
        return balance - startingAmount;
    }

    public boolean isTrackingHistory() {
        return trackHistory;
    }

    /**
     * Balance after each result, oldest first. Empty unless history tracking is on.
     */
    public List<Double> getHistory() {
        return Collections.unmodifiableList(history);
    }

    @Override
    public String toString() {
        return "BankrollTracker(balance=" + balance + ", peak=" + peak + ", maxDrawdown=" + maxDrawdown + ")";
    }
}
