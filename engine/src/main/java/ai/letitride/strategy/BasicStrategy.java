package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;

/**
 * The mathematically optimal fixed strategy for the standard paytable.
 *
 * <p>Bet 1 (three cards), ride with:
 * <ol>
 *     <li>any paying hand (tens or better, trips)</li>
 *     <li>three to a royal flush</li>
 *     <li>three suited in a row, except A-2-3 and 2-3-4</li>
 *     <li>three to a straight flush, spread 4, with at least one high card</li>
 *     <li>three to a straight flush, spread 5, with at least two high cards</li>
 * </ol>
 *
 * <p>Bet 2 (four cards), ride with:
 * <ol>
 *     <li>any paying hand (tens or better, two pair, trips)</li>
 *     <li>four to a flush</li>
 *     <li>four to an outside straight with at least one high card</li>
 *     <li>four to an inside straight with four high cards</li>
 * </ol>
 * Everything else is pulled.
 */
public final class BasicStrategy implements Strategy {

    @Override
    public Decision decideBet1(HandAnalysis analysis, StrategyContext context) {
        if (analysis.hasPayingHand() || analysis.isRoyalDraw()) {
            return Decision.RIDE;
        }
        if (analysis.isStraightFlushDraw() && analysis.getSuitedCards() == 3) {
            int spread = analysis.getStraightFlushSpread();
            if (spread == 3 && !analysis.isExcludedStraightFlushConsecutive()) {
                return Decision.RIDE;
            }
            if (spread == 4 && analysis.getSuitedHighCards() >= 1) {
                return Decision.RIDE;
            }
            if (spread == 5 && analysis.getSuitedHighCards() >= 2) {
                return Decision.RIDE;
            }
        }
        return Decision.PULL;
    }

    @Override
    public Decision decideBet2(HandAnalysis analysis, StrategyContext context) {
        if (analysis.hasPayingHand()) {
            return Decision.RIDE;
        }
        if (analysis.isFlushDraw() && analysis.getSuitedCards() >= 4) {
            return Decision.RIDE;
        }
        if (analysis.isOpenStraightDraw() && analysis.getHighCards() >= 1) {
            return Decision.RIDE;
        }
        if (analysis.isInsideStraightDraw() && analysis.getHighCards() >= 4) {
            return Decision.RIDE;
        }
        return Decision.PULL;
    }
}
