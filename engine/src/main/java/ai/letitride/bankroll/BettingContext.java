package ai.letitride.bankroll;

import java.util.OptionalDouble;

/**
 * Session state handed to a {@link BettingSystem} when it sizes the next bet.
 */
public final class BettingContext {
    private final double bankroll;
    private final double startingBankroll;
    private final double sessionProfit;
    private final Double lastResult;
    private final int streak;
    private final int handsPlayed;

    /**
     * @param lastResult net result of the previous hand, {@code null} before the first hand
     */
    public BettingContext(double bankroll, double startingBankroll, double sessionProfit, Double lastResult,
                          int streak, int handsPlayed) {
        this.bankroll = bankroll;
        this.startingBankroll = startingBankroll;
        this.sessionProfit = sessionProfit;
        this.lastResult = lastResult;
        this.streak = streak;
        this.handsPlayed = handsPlayed;
    }

    public double getBankroll() {
        return bankroll;
    }

    public double getStartingBankroll() {
        return startingBankroll;
    }

    public double getSessionProfit() {
        return sessionProfit;
    }

    public OptionalDouble getLastResult() {
        return lastResult == null ? OptionalDouble.empty() : OptionalDouble.of(lastResult);
    }

    public int getStreak() {
        return streak;
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }
}
