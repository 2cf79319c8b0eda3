package ai.letitride.bankroll;

/**
 * Bets {@code unit} times the Fibonacci number at the current position (1, 1, 2, 3, 5, 8, ...).
 * <p>
 * A loss moves one position forward, up to {@code maxPosition}; a win moves {@code winRegression}
 * positions back, never below the start. Pushes change nothing.
 */
public final class FibonacciBetting implements BettingSystem {
    private final double unit;
    private final double maxBet;
    private final int maxPosition;
    private final int winRegression;
    private final long[] sequence;

    private int position;

    public FibonacciBetting(double unit, double maxBet, int maxPosition, int winRegression) {
        if (unit <= 0) {
            throw new IllegalArgumentException("Unit must be positive, got " + unit);
        }
        if (maxBet <= 0) {
            throw new IllegalArgumentException("Max bet must be positive, got " + maxBet);
        }
        if (maxPosition < 1 || maxPosition > 90) {
            throw new IllegalArgumentException("Max position must be between 1 and 90, got " + maxPosition);
        }
        if (winRegression < 1) {
            throw new IllegalArgumentException("Win regression must be at least 1, got " + winRegression);
        }
        this.unit = unit;
        this.maxBet = maxBet;
        this.maxPosition = maxPosition;
        this.winRegression = winRegression;
        this.sequence = new long[maxPosition + 1];
        sequence[0] = 1;
        sequence[1] = 1;
        for (int i = 2; i <= maxPosition; i++) {
            sequence[i] = sequence[i - 1] + sequence[i - 2];
        }
    }

    @Override
    public double nextBet(BettingContext context) {
        if (context.getBankroll() <= 0) {
            return 0.0;
        }
        double bet = unit * sequence[position];
        return Math.min(Math.min(bet, maxBet), context.getBankroll());
    }

    @Override
    public void recordResult(double netResult) {
        if (netResult < 0) {
            position = Math.min(position + 1, maxPosition);
        } else if (netResult > 0) {
            position = Math.max(position - winRegression, 0);
        }
    }

    @Override
    public void reset() {
        position = 0;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "FibonacciBetting(unit=" + unit + ", maxPosition=" + maxPosition + ", regression=" + winRegression + ")";
    }
}
