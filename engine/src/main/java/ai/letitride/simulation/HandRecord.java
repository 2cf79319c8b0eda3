package ai.letitride.simulation;

import ai.letitride.engine.GameHandResult;
import ai.letitride.game.Card;
import ai.letitride.game.ThreeCardHandRank;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Serializable record of one hand, with cards, decisions and ranks in their text form
 * ({@code "Ah Kd Qs"}, {@code "ride"}, {@code "flush"}).
 *
 * <p>Serialized by Jackson with snake_case property names; {@code seat_number} is {@code null}
 * for single-player sessions and {@code bonus_hand_rank} for hands without a bonus bet.
 */
@JsonPropertyOrder({"session_id", "seat_number", "hand_id", "cards_player", "cards_community", "decision_bet1",
        "decision_bet2", "final_hand_rank", "base_bet", "bets_at_risk", "main_payout", "bonus_bet",
        "bonus_hand_rank", "bonus_payout", "net_result", "bankroll_after"})
public final class HandRecord {
    private final int sessionId;
    private final Integer seatNumber;
    private final int handId;
    private final String cardsPlayer;
    private final String cardsCommunity;
    private final String decisionBet1;
    private final String decisionBet2;
    private final String finalHandRank;
    private final double baseBet;
    private final double betsAtRisk;
    private final double mainPayout;
    private final double bonusBet;
    private final String bonusHandRank;
    private final double bonusPayout;
    private final double netResult;
    private final double bankrollAfter;

    @JsonCreator
    public HandRecord(@JsonProperty("session_id") int sessionId,
                      @JsonProperty("seat_number") Integer seatNumber,
                      @JsonProperty("hand_id") int handId,
                      @JsonProperty("cards_player") String cardsPlayer,
                      @JsonProperty("cards_community") String cardsCommunity,
                      @JsonProperty("decision_bet1") String decisionBet1,
                      @JsonProperty("decision_bet2") String decisionBet2,
                      @JsonProperty("final_hand_rank") String finalHandRank,
                      @JsonProperty("base_bet") double baseBet,
                      @JsonProperty("bets_at_risk") double betsAtRisk,
                      @JsonProperty("main_payout") double mainPayout,
                      @JsonProperty("bonus_bet") double bonusBet,
                      @JsonProperty("bonus_hand_rank") String bonusHandRank,
                      @JsonProperty("bonus_payout") double bonusPayout,
                      @JsonProperty("net_result") double netResult,
                      @JsonProperty("bankroll_after") double bankrollAfter) {
        this.sessionId = sessionId;
        this.seatNumber = seatNumber;
        this.handId = handId;
        this.cardsPlayer = cardsPlayer;
        this.cardsCommunity = cardsCommunity;
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
        this.bankrollAfter = bankrollAfter;
    }

    /**
     * @param seatNumber seat at a table, {@code null} for a single-player session
     */
    public static HandRecord fromGameHandResult(GameHandResult hand, int sessionId, Integer seatNumber,
                                                double bankrollAfter) {
        return new HandRecord(sessionId, seatNumber, hand.getHandId(),
                Card.format(hand.getPlayerCards()),
                Card.format(hand.getCommunityCards()),
                hand.getDecisionBet1().token(),
                hand.getDecisionBet2().token(),
                hand.getFinalHandRank().wireName(),
                hand.getBaseBet(),
                hand.getBetsAtRisk(),
                hand.getMainPayout(),
                hand.getBonusBet(),
                hand.getBonusHandRank().map(ThreeCardHandRank::wireName).orElse(null),
                hand.getBonusPayout(),
                hand.getNetResult(),
                bankrollAfter);
    }

    @JsonProperty("session_id")
    public int getSessionId() {
        return sessionId;
    }

    @JsonProperty("seat_number")
    public Integer getSeatNumber() {
        return seatNumber;
    }

    @JsonProperty("hand_id")
    public int getHandId() {
        return handId;
    }

    @JsonProperty("cards_player")
    public String getCardsPlayer() {
        return cardsPlayer;
    }

    @JsonProperty("cards_community")
    public String getCardsCommunity() {
        return cardsCommunity;
    }

    @JsonProperty("decision_bet1")
    public String getDecisionBet1() {
        return decisionBet1;
    }

    @JsonProperty("decision_bet2")
    public String getDecisionBet2() {
        return decisionBet2;
    }

    @JsonProperty("final_hand_rank")
    public String getFinalHandRank() {
        return finalHandRank;
    }

    @JsonProperty("base_bet")
    public double getBaseBet() {
        return baseBet;
    }

    @JsonProperty("bets_at_risk")
    public double getBetsAtRisk() {
        return betsAtRisk;
    }

    @JsonProperty("main_payout")
    public double getMainPayout() {
        return mainPayout;
    }

    @JsonProperty("bonus_bet")
    public double getBonusBet() {
        return bonusBet;
    }

    @JsonProperty("bonus_hand_rank")
    public String getBonusHandRank() {
        return bonusHandRank;
    }

    @JsonProperty("bonus_payout")
    public double getBonusPayout() {
        return bonusPayout;
    }

    @JsonProperty("net_result")
    public double getNetResult() {
        return netResult;
    }

    @JsonProperty("bankroll_after")
    public double getBankrollAfter() {
        return bankrollAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandRecord)) {
            return false;
        }
        HandRecord that = (HandRecord) o;
        return sessionId == that.sessionId && handId == that.handId
                && Double.compare(baseBet, that.baseBet) == 0
                && Double.compare(betsAtRisk, that.betsAtRisk) == 0
                && Double.compare(mainPayout, that.mainPayout) == 0
                && Double.compare(bonusBet, that.bonusBet) == 0
                && Double.compare(bonusPayout, that.bonusPayout) == 0
                && Double.compare(netResult, that.netResult) == 0
                && Double.compare(bankrollAfter, that.bankrollAfter) == 0
                && Objects.equals(seatNumber, that.seatNumber)
                && cardsPlayer.equals(that.cardsPlayer)
                && cardsCommunity.equals(that.cardsCommunity)
                && decisionBet1.equals(that.decisionBet1)
                && decisionBet2.equals(that.decisionBet2)
                && finalHandRank.equals(that.finalHandRank)
                && Objects.equals(bonusHandRank, that.bonusHandRank);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, seatNumber, handId, cardsPlayer, cardsCommunity, finalHandRank, netResult);
    }

    @Override
    public String toString() {
        return "HandRecord(session=" + sessionId + (seatNumber != null ? ", seat=" + seatNumber : "")
                + ", hand=" + handId + ", " + cardsPlayer + " | " + cardsCommunity + ", " + decisionBet1 + "/"
                + decisionBet2 + ", " + finalHandRank + ", net=" + netResult + ")";
    }
}
