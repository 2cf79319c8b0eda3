package ai.letitride.engine;

import ai.letitride.game.Card;
import ai.letitride.game.FiveCardHandRank;
import ai.letitride.game.ThreeCardHandRank;
import ai.letitride.strategy.Decision;
import java.util.List;
import java.util.Optional;

/**
 * Everything that happened in one hand: the cards, both decisions and the settled amounts.
 * <p>
 * {@code mainPayout} and {@code bonusPayout} are winnings (0 when the bet lost);
 * {@code netResult} is the change in bankroll.
 */
public final class GameHandResult {
    private final int handId;
    private final List<Card> playerCards;
    private final List<Card> communityCards;
    private final Decision decisionBet1;
    private final Decision decisionBet2;
    private final FiveCardHandRank finalHandRank;
    private final double baseBet;
    private final double betsAtRisk;
    private final double mainPayout;
    private final double bonusBet;
    private final ThreeCardHandRank bonusHandRank;
    private final double bonusPayout;
    private final double netResult;

    GameHandResult(int handId, List<Card> playerCards, List<Card> communityCards, double baseBet, double bonusBet,
                   HandSettlement settlement) {
        this(handId, playerCards, communityCards, settlement.getDecisionBet1(), settlement.getDecisionBet2(),
                settlement.getFinalHand().getRank(), baseBet, settlement.getBetsAtRisk(), settlement.getMainPayout(),
                bonusBet, settlement.getBonusHandRank().orElse(null), settlement.getBonusPayout(),
                settlement.getNetResult());
    }

    public GameHandResult(int handId, List<Card> playerCards, List<Card> communityCards, Decision decisionBet1,
                          Decision decisionBet2, FiveCardHandRank finalHandRank, double baseBet, double betsAtRisk,
                          double mainPayout, double bonusBet, ThreeCardHandRank bonusHandRank, double bonusPayout,
                          double netResult) {
        this.handId = handId;
        this.playerCards = List.copyOf(playerCards);
        this.communityCards = List.copyOf(communityCards);
        this.decisionBet1 = decisionBet1;
        this.decisionBet2 = decisionBet2;
        this.finalHandRank = finalHandRank;
        this.baseBet = baseBet;
        this.betsAtRisk = betsAtRisk;
        this.mainPayout = mainPayout;
        this.bonusBet = bonusBet;
        this.bonusHandRank = bonusHandRank;
        this.bonusPayout = bonusPayout;
        this.netResult = netResult;
    }

    public int getHandId() {
        return handId;
    }

    public List<Card> getPlayerCards() {
        return playerCards;
    }

    public List<Card> getCommunityCards() {
        return communityCards;
    }

    public Decision getDecisionBet1() {
        return decisionBet1;
    }

    public Decision getDecisionBet2() {
        return decisionBet2;
    }

    public FiveCardHandRank getFinalHandRank() {
        return finalHandRank;
    }

    public double getBaseBet() {
        return baseBet;
    }

    public double getBetsAtRisk() {
        return betsAtRisk;
    }

    public double getMainPayout() {
        return mainPayout;
    }

    public double getBonusBet() {
        return bonusBet;
    }

    /** Empty when no bonus bet was placed. */
    public Optional<ThreeCardHandRank> getBonusHandRank() {
        return Optional.ofNullable(bonusHandRank);
    }

    public double getBonusPayout() {
        return bonusPayout;
    }

    public double getNetResult() {
        return netResult;
    }

    @Override
    public String toString() {
        return "GameHandResult(#" + handId + " " + Card.format(playerCards) + " | " + Card.format(communityCards)
                + ", " + decisionBet1 + "/" + decisionBet2 + ", " + finalHandRank.wireName()
                + ", net=" + netResult + ")";
    }
}
