package ai.letitride.engine;

import ai.letitride.game.Card;
import ai.letitride.game.FiveCardEvaluator;
import ai.letitride.game.HandAnalyzer;
import ai.letitride.game.HandResult;
import ai.letitride.game.Rank;
import ai.letitride.game.ThreeCardEvaluator;
import ai.letitride.game.ThreeCardHandRank;
import ai.letitride.paytable.BonusPaytable;
import ai.letitride.paytable.MainGamePaytable;
import ai.letitride.strategy.Decision;
import ai.letitride.strategy.Strategy;
import ai.letitride.strategy.StrategyContext;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decisions and payouts for one player's hand, shared by the single-player engine and the table.
 *
 * <p>Order of play: bet 1 is decided on the three player cards, bet 2 on those plus the first
 * community card, then the five cards are evaluated and the bonus and main bets are settled.
 * The amount at risk is the base bet times the bets still in action (1 to 3); a winning main bet
 * pays its multiplier on that amount and a losing one costs all of it.
 */
public final class HandSettlement {
    private final Decision decisionBet1;
    private final Decision decisionBet2;
    private final HandResult finalHand;
    private final double betsAtRisk;
    private final double mainPayout;
    private final ThreeCardHandRank bonusHandRank;
    private final double bonusPayout;
    private final double netResult;

    private HandSettlement(Decision decisionBet1, Decision decisionBet2, HandResult finalHand, double betsAtRisk,
                           double mainPayout, ThreeCardHandRank bonusHandRank, double bonusPayout, double netResult) {
        this.decisionBet1 = decisionBet1;
        this.decisionBet2 = decisionBet2;
        this.finalHand = finalHand;
        this.betsAtRisk = betsAtRisk;
        this.mainPayout = mainPayout;
        this.bonusHandRank = bonusHandRank;
        this.bonusPayout = bonusPayout;
        this.netResult = netResult;
    }

    /**
     * Rejects stakes the table would not accept.
     *
     * @throws IllegalArgumentException if the base bet is not positive, the bonus bet is negative, or a
     *                                  bonus bet is placed without a bonus paytable
     */
    static void validateBets(double baseBet, double bonusBet, BonusPaytable bonusPaytable) {
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        if (bonusBet < 0) {
            throw new IllegalArgumentException("Bonus bet cannot be negative, got " + bonusBet);
        }
        if (bonusBet > 0 && bonusPaytable == null) {
            throw new IllegalArgumentException("A bonus bet requires a bonus paytable");
        }
    }

    static HandSettlement settle(List<Card> playerCards, List<Card> communityCards, Strategy strategy,
                                 MainGamePaytable mainPaytable, BonusPaytable bonusPaytable,
                                 double baseBet, double bonusBet, StrategyContext context) {
        List<Card> fourCards = new ArrayList<>(4);
        fourCards.addAll(playerCards);
        fourCards.add(communityCards.get(0));

        boolean composition = strategy.usesDeckComposition();
        Decision bet1 = strategy.decideBet1(HandAnalyzer.analyzeThreeCards(playerCards),
                composition ? context.withDeckComposition(unseenComposition(playerCards)) : context);
        Decision bet2 = strategy.decideBet2(HandAnalyzer.analyzeFourCards(fourCards),
                composition ? context.withDeckComposition(unseenComposition(fourCards)) : context);

        List<Card> fiveCards = new ArrayList<>(fourCards);
        fiveCards.add(communityCards.get(1));
        HandResult finalHand = FiveCardEvaluator.evaluate(fiveCards);

        ThreeCardHandRank bonusRank = null;
        double bonusPayout = 0.0;
        if (bonusBet > 0) {
            bonusRank = ThreeCardEvaluator.evaluate(playerCards);
            bonusPayout = bonusPaytable.payout(bonusRank, bonusBet);
        }

        int betsInAction = 1 + (bet1 == Decision.RIDE ? 1 : 0) + (bet2 == Decision.RIDE ? 1 : 0);
        double betsAtRisk = baseBet * betsInAction;
        double mainPayout = mainPaytable.payout(finalHand.getRank(), betsAtRisk);

        double mainNet = mainPayout > 0 ? mainPayout : -betsAtRisk;
        double bonusNet = bonusPayout > 0 ? bonusPayout : -bonusBet;
        return new HandSettlement(bet1, bet2, finalHand, betsAtRisk, mainPayout, bonusRank, bonusPayout,
                mainNet + bonusNet);
    }

    /**
     * Rank counts of the cards the player cannot see: the full deck minus the visible cards.
     */
    private static Map<Rank, Integer> unseenComposition(List<Card> visible) {
        Map<Rank, Integer> counts = new EnumMap<>(Rank.class);
        for (Rank rank : Rank.values()) {
            counts.put(rank, 4);
        }
        for (Card card : visible) {
            counts.merge(card.getRank(), -1, Integer::sum);
        }
        return counts;
    }

    public Decision getDecisionBet1() {
        return decisionBet1;
    }

    public Decision getDecisionBet2() {
        return decisionBet2;
    }

    public HandResult getFinalHand() {
        return finalHand;
    }

    public double getBetsAtRisk() {
        return betsAtRisk;
    }

    public double getMainPayout() {
        return mainPayout;
    }

    public Optional<ThreeCardHandRank> getBonusHandRank() {
        return Optional.ofNullable(bonusHandRank);
    }

    public double getBonusPayout() {
        return bonusPayout;
    }

    public double getNetResult() {
        return netResult;
    }
}
