package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;

/** Baseline that never pulls. Maximum variance. */
public final class AlwaysRideStrategy implements Strategy {

    @Override
    public Decision decideBet1(HandAnalysis analysis, StrategyContext context) {
        return Decision.RIDE;
    }

    @Override
    public Decision decideBet2(HandAnalysis analysis, StrategyContext context) {
        return Decision.RIDE;
    }
}
