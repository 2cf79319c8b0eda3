package ai.letitride.bankroll;

/**
 * Multiplies the base bet after every win and drops back to it after a loss or a push.
 * <p>
 * After {@code profitTargetStreak} wins in a row the progression banks the profit and starts over.
 */
public final class ReverseMartingaleBetting implements BettingSystem {
    private final double baseBet;
    private final double winMultiplier;
    private final double maxBet;
    private final int profitTargetStreak;

    private int winStreak;

    /**
     * @throws IllegalArgumentException for a non-positive base or max bet, a multiplier of 1 or less,
     *                                  or a profit target below one win
     */
    public ReverseMartingaleBetting(double baseBet, double winMultiplier, double maxBet, int profitTargetStreak) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        if (winMultiplier <= 1) {
            throw new IllegalArgumentException("Win multiplier must be greater than 1, got " + winMultiplier);
        }
        if (maxBet <= 0) {
            throw new IllegalArgumentException("Max bet must be positive, got " + maxBet);
        }
        if (profitTargetStreak < 1) {
            throw new IllegalArgumentException("Profit target streak must be at least 1, got " + profitTargetStreak);
        }
        this.baseBet = baseBet;
        this.winMultiplier = winMultiplier;
        this.maxBet = maxBet;
        this.profitTargetStreak = profitTargetStreak;
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        double bet = baseBet * Math.pow(winMultiplier, winStreak);
        return Math.min(Math.min(bet, maxBet), context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        if (netResult > 0) {
            winStreak++;
            if (winStreak >= profitTargetStreak) {
                winStreak = 0;
            }
        } else {
            winStreak = 0;
        }
    }

    @Override
    public void reset() {
        winStreak = 0;
    }

    public int getWinStreak() {
        return winStreak;
    }

    @Override
    public String toString() {
        return "ReverseMartingaleBetting(base=" + baseBet + ", x" + winMultiplier + ", target=" + profitTargetStreak
                + ")";
    }
}
