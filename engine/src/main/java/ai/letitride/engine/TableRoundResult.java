package ai.letitride.engine;

import ai.letitride.game.Card;
import java.util.List;
import java.util.Optional;

/**
 * Result of one round at a multi-seat table. Only seats that placed a wager have a result.
 */
public final class TableRoundResult {
    private final int roundId;
    private final List<Card> communityCards;
    private final List<Card> dealerDiscards;
    private final List<SeatRoundResult> seatResults;

    public TableRoundResult(int roundId, List<Card> communityCards, List<Card> dealerDiscards,
                            List<SeatRoundResult> seatResults) {
        this.roundId = roundId;
        this.communityCards = List.copyOf(communityCards);
        this.dealerDiscards = List.copyOf(dealerDiscards);
        this.seatResults = List.copyOf(seatResults);
    }

    public int getRoundId() {
        return roundId;
    }

    public List<Card> getCommunityCards() {
        return communityCards;
    }

    /** Empty when dealer discard is disabled. */
    public List<Card> getDealerDiscards() {
        return dealerDiscards;
    }

    public List<SeatRoundResult> getSeatResults() {
        return seatResults;
    }

    public Optional<SeatRoundResult> seat(int seatNumber) {
        for (SeatRoundResult result : seatResults) {
            if (result.getSeatNumber() == seatNumber) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }
}
