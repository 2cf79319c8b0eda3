package ai.letitride.simulation;

/**
 * Sign of a finished session's profit.
 */
public enum SessionOutcome {
    WIN,
    LOSS,
    PUSH;

    public static SessionOutcome fromProfit(double profit) {
        if (profit > 0) {
            return WIN;
        }
        return profit < 0 ? LOSS : PUSH;
    }
}
