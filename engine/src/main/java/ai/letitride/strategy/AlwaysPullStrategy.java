package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;

/** Baseline that pulls whenever allowed, leaving only the third bet in action. */
public final class AlwaysPullStrategy implements Strategy {

    @Override
    public Decision decideBet1(HandAnalysis analysis, StrategyContext context) {
        return Decision.PULL;
    }

    @Override
    public Decision decideBet2(HandAnalysis analysis, StrategyContext context) {
        return Decision.PULL;
    }
}
