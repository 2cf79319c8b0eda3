package ai.letitride.bankroll;

/**
 * Sizes the base bet (the amount placed on each of the three circles) for the next hand.
 *
 * <p>A betting system is stateful and owned by a single session. The session calls
 * {@link #nextBet(BettingContext)} before each hand and {@link #recordResult(double)} after it.
 */
public interface BettingSystem {

    /**
     * @return the base bet for the next hand; 0 when the bankroll cannot cover any bet
     */
    double nextBet(BettingContext context);

    /**
     * @param netResult the net result of the hand just played
     */
    void recordResult(double netResult);

    /** Returns to the opening state for a new session. */
    void reset();
}
