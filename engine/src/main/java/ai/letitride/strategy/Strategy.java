package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;

/**
 * Decides whether to pull or ride each of the two pullable bets.
 *
 * <p>Implementations must be stateless with respect to the hands they see: the same analysis and
 * context always produce the same decision. One instance is shared by every worker thread of a
 * simulation.
 */
public interface Strategy {

    /**
     * First decision, made on the player's three cards.
     */
    Decision decideBet1(HandAnalysis analysis, StrategyContext context);

    /**
     * Second decision, made on the player's cards plus the first community card.
     */
    Decision decideBet2(HandAnalysis analysis, StrategyContext context);

    /**
     * Whether the engine should attach the remaining-deck composition to the context.
     * Computing it costs a pass over the deck, so it is off unless asked for.
     */
    default boolean usesDeckComposition() {
        return false;
    }
}
