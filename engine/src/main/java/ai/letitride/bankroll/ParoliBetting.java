package ai.letitride.bankroll;

/**
 * Lets winnings ride for a fixed number of wins, then returns to the base bet.
 * <p>
 * A loss ends the run early. A push leaves it where it is.
 */
public final class ParoliBetting implements BettingSystem {
    private final double baseBet;
    private final double winMultiplier;
    private final double maxBet;
    private final int winsBeforeReset;

    private int consecutiveWins;

    public ParoliBetting(double baseBet, double winMultiplier, double maxBet, int winsBeforeReset) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        if (winMultiplier <= 1) {
            throw new IllegalArgumentException("Win multiplier must be greater than 1, got " + winMultiplier);
        }
        if (maxBet <= 0) {
            throw new IllegalArgumentException("Max bet must be positive, got " + maxBet);
        }
        if (winsBeforeReset < 1) {
            throw new IllegalArgumentException("Wins before reset must be at least 1, got " + winsBeforeReset);
        }
        this.baseBet = baseBet;
        this.winMultiplier = winMultiplier;
        this.maxBet = maxBet;
        this.winsBeforeReset = winsBeforeReset;
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        double bet = baseBet * Math.pow(winMultiplier, consecutiveWins);
        return Math.min(Math.min(bet, maxBet), context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        if (netResult > 0) {
            consecutiveWins++;
            if (consecutiveWins >= winsBeforeReset) {
                consecutiveWins = 0;
            }
        } else if (netResult < 0) {
            consecutiveWins = 0;
        }
    }

    @Override
    public void reset() {
        consecutiveWins = 0;
    }

    public int getConsecutiveWins() {
        return consecutiveWins;
    }

    @Override
    public String toString() {
        return "ParoliBetting(base=" + baseBet + ", x" + winMultiplier + ", wins=" + winsBeforeReset + ")";
    }
}
