package ai.letitride.bankroll;

/**
 * Raises the bet by one unit after a loss and lowers it by one unit after a win, within
 * {@code [minBet, maxBet]}. Pushes change nothing.
 */
public final class DAlembertBetting implements BettingSystem {
    private final double baseBet;
    private final double unit;
    private final double minBet;
    private final double maxBet;

    private double currentBet;

    /**
     * @throws IllegalArgumentException for a non-positive amount or {@code minBet > maxBet}
     */
    public DAlembertBetting(double baseBet, double unit, double minBet, double maxBet) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        if (unit <= 0) {
            throw new IllegalArgumentException("Unit must be positive, got " + unit);
        }
        if (minBet <= 0 || maxBet <= 0) {
            throw new IllegalArgumentException("Bet limits must be positive, got " + minBet + " and " + maxBet);
        }
        if (minBet > maxBet) {
            throw new IllegalArgumentException("Min bet " + minBet + " exceeds max bet " + maxBet);
        }
        this.baseBet = baseBet;
        this.unit = unit;
        this.minBet = minBet;
        this.maxBet = maxBet;
        this.currentBet = clamp(baseBet);
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        return Math.min(currentBet, context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        if (netResult > 0) {
            currentBet = clamp(currentBet - unit);
        } else if (netResult < 0) {
            currentBet = clamp(currentBet + unit);
        }
    }

    @Override
    public void reset() {
        currentBet = clamp(baseBet);
    }

    private double clamp(double bet) {
        return Math.max(minBet, Math.min(maxBet, bet));
    }

    @Override
    public String toString() {
        return "DAlembertBetting(base=" + baseBet + ", unit=" + unit + ", range=" + minBet + "-" + maxBet + ")";
    }
}
