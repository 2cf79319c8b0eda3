package ai.letitride.bankroll;

/**
 * Multiplies the base bet after every loss and returns to it after a win.
 * <p>
 * The progression stops growing after {@code maxProgressions} consecutive losses, and a bet never
 * exceeds {@code maxBet} or the bankroll. Pushes leave the progression where it is.
 */
public final class MartingaleBetting implements BettingSystem {
    private final double baseBet;
    private final double lossMultiplier;
    private final double maxBet;
    private final int maxProgressions;

    private int progressions;

    /**
     * @throws IllegalArgumentException for a non-positive base or max bet, a multiplier of 1 or less,
     *                                  or fewer than one progression
     */
    public MartingaleBetting(double baseBet, double lossMultiplier, double maxBet, int maxProgressions) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        if (lossMultiplier <= 1) {
            throw new IllegalArgumentException("Loss multiplier must be greater than 1, got " + lossMultiplier);
        }
        if (maxBet <= 0) {
            throw new IllegalArgumentException("Max bet must be positive, got " + maxBet);
        }
        if (maxProgressions < 1) {
            throw new IllegalArgumentException("Max progressions must be at least 1, got " + maxProgressions);
        }
        this.baseBet = baseBet;
        this.lossMultiplier = lossMultiplier;
        this.maxBet = maxBet;
        this.maxProgressions = maxProgressions;
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        double bet = baseBet * Math.pow(lossMultiplier, progressions);
        return Math.min(Math.min(bet, maxBet), context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        if (netResult > 0) {
            progressions = 0;
        } else if (netResult < 0 && progressions < maxProgressions) {
            progressions++;
        }
    }

    @Override
    public void reset() {
        progressions = 0;
    }

    public int getProgressions() {
        return progressions;
    }

    @Override
    public String toString() {
        return "MartingaleBetting(base=" + baseBet + ", x" + lossMultiplier + ", max=" + maxBet + ")";
    }
}
