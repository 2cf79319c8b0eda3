package ai.letitride.strategy;

import ai.letitride.game.Rank;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the session a decision is made in.
 * <p>
 * The remaining-deck composition is only filled in for strategies that ask for it through
 * {@link Strategy#usesDeckComposition()}.
 */
public final class StrategyContext {
    /** Context used when a hand is played outside a session. */
    public static final StrategyContext EMPTY = new StrategyContext(0.0, 0, 0, 0.0);

    private final double sessionProfit;
    private final int handsPlayed;
    private final int streak;
    private final double bankroll;
    private final Map<Rank, Integer> deckComposition;

    public StrategyContext(double sessionProfit, int handsPlayed, int streak, double bankroll) {
        this(sessionProfit, handsPlayed, streak, bankroll, null);
    }

    private StrategyContext(double sessionProfit, int handsPlayed, int streak, double bankroll,
                            Map<Rank, Integer> deckComposition) {
        this.sessionProfit = sessionProfit;
        this.handsPlayed = handsPlayed;
        this.streak = streak;
        this.bankroll = bankroll;
        this.deckComposition = deckComposition;
    }

    /**
     * Returns a copy of this context carrying the remaining-deck composition.
     */
    public StrategyContext withDeckComposition(Map<Rank, Integer> composition) {
        Map<Rank, Integer> copy = Collections.unmodifiableMap(new EnumMap<>(composition));
        return new StrategyContext(sessionProfit, handsPlayed, streak, bankroll, copy);
    }

    public double getSessionProfit() {
        return sessionProfit;
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }

    /** Positive for consecutive wins, negative for consecutive losses, 0 at the start. */
    public int getStreak() {
        return streak;
    }

    public double getBankroll() {
        return bankroll;
    }

    public Optional<Map<Rank, Integer>> getDeckComposition() {
        return Optional.ofNullable(deckComposition);
    }

    @Override
    public String toString() {
        return "StrategyContext(profit=" + sessionProfit + ", hands=" + handsPlayed + ", streak=" + streak
                + ", bankroll=" + bankroll + ")";
    }
}
