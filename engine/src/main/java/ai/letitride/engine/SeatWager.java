package ai.letitride.engine;

import ai.letitride.strategy.StrategyContext;
import java.util.Objects;

/**
 * One seat's stakes and strategy context for a table round.
 */
public final class SeatWager {
    private final double baseBet;
    private final double bonusBet;
    private final StrategyContext context;

    public SeatWager(double baseBet, double bonusBet, StrategyContext context) {
        this.baseBet = baseBet;
        this.bonusBet = bonusBet;
        this.context = Objects.requireNonNull(context, "context");
    }

    public double getBaseBet() {
        return baseBet;
    }

    public double getBonusBet() {
        return bonusBet;
    }

    public StrategyContext getContext() {
        return context;
    }
}
