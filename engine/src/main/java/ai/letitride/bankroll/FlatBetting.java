package ai.letitride.bankroll;

/**
 * Bets the same base amount every hand, capped by what is left in the bankroll.
 */
public final class FlatBetting implements BettingSystem {
    private final double baseBet;

    public FlatBetting(double baseBet) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        this.baseBet = baseBet;
    }

    public double getBaseBet() {
        return baseBet;
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        return Math.min(baseBet, context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        // flat: nothing to track
    }

    @Override
    public void reset() {
        // flat: nothing to reset
    }

    @Override
    public String toString() {
        return "FlatBetting(" + baseBet + ")";
    }
}
