package ai.letitride.engine;

import ai.letitride.game.Card;
import ai.letitride.game.Deck;
import ai.letitride.paytable.BonusPaytable;
import ai.letitride.paytable.MainGamePaytable;
import ai.letitride.strategy.Strategy;
import ai.letitride.strategy.StrategyContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Let It Ride table: several seats dealt from one deck and sharing the two community cards.
 *
 * <p>Per round the deck is reset and shuffled, every seat receives three cards (seat 1 first),
 * the dealer discard is burned when enabled, and the two community cards are dealt. Every seat is
 * dealt in, even one sitting out, so a seat's cards do not depend on whether its neighbours play.
 * Each playing seat is then settled with its own wager and strategy context.
 */
public class Table {
    private static final Logger log = LoggerFactory.getLogger(Table.class);

    private final Deck deck;
    private final Strategy strategy;
    private final MainGamePaytable mainPaytable;
    private final BonusPaytable bonusPaytable;
    private final Random rng;
    private final int numSeats;
    private final DealerSettings dealerSettings;
    private List<Card> lastDiscardedCards = List.of();

    /**
     * @param numSeats number of seats dealt each round (at least 1)
     */
    public Table(Deck deck, Strategy strategy, MainGamePaytable mainPaytable, BonusPaytable bonusPaytable,
                 Random rng, int numSeats, DealerSettings dealerSettings) {
        if (numSeats < 1) {
            throw new IllegalArgumentException("A table needs at least one seat, got " + numSeats);
        }
        this.deck = Objects.requireNonNull(deck, "deck");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.mainPaytable = Objects.requireNonNull(mainPaytable, "mainPaytable");
        this.bonusPaytable = bonusPaytable;
        this.rng = Objects.requireNonNull(rng, "rng");
        this.numSeats = numSeats;
        this.dealerSettings = Objects.requireNonNull(dealerSettings, "dealerSettings");
    }

    public int getNumSeats() {
        return numSeats;
    }

    /**
     * Plays a round with every seat wagering the same stakes under the same context.
     */
    public TableRoundResult playRound(int roundId, double baseBet, double bonusBet, StrategyContext context) {
        SeatWager wager = new SeatWager(baseBet, bonusBet, context != null ? context : StrategyContext.EMPTY);
        return playRound(roundId, Collections.nCopies(numSeats, wager));
    }

    /**
     * Plays a round.
     *
     * @param roundId identifier carried into every seat's hand
     * @param wagers  one entry per seat, in seat order; {@code null} for a seat that sits out
     * @return community cards, discards and a result per playing seat
     * @throws IllegalArgumentException if the wager list does not match the seat count or a stake is invalid
     * @throws ai.letitride.game.InsufficientCardsException if the deck cannot serve every seat
     */
    public TableRoundResult playRound(int roundId, List<SeatWager> wagers) {
        if (wagers.size() != numSeats) {
            throw new IllegalArgumentException("Expected " + numSeats + " seat wagers, got " + wagers.size());
        }
        for (SeatWager wager : wagers) {
            if (wager != null) {
                HandSettlement.validateBets(wager.getBaseBet(), wager.getBonusBet(), bonusPaytable);
            }
        }

        deck.reset();
        deck.shuffle(rng);

        List<List<Card>> seatCards = new ArrayList<>(numSeats);
        for (int seat = 0; seat < numSeats; seat++) {
            seatCards.add(deck.deal(3));
        }
        lastDiscardedCards = dealerSettings.isDiscardEnabled()
                ? deck.deal(dealerSettings.getDiscardCards())
                : List.of();
        List<Card> communityCards = deck.deal(2);

        List<SeatRoundResult> results = new ArrayList<>(numSeats);
        for (int seat = 0; seat < numSeats; seat++) {
            SeatWager wager = wagers.get(seat);
            if (wager == null) {
                continue;
            }
            List<Card> playerCards = seatCards.get(seat);
            HandSettlement settlement = HandSettlement.settle(playerCards, communityCards, strategy, mainPaytable,
                    bonusPaytable, wager.getBaseBet(), wager.getBonusBet(), wager.getContext());
            results.add(new SeatRoundResult(seat + 1, new GameHandResult(roundId, playerCards, communityCards,
                    wager.getBaseBet(), wager.getBonusBet(), settlement)));
        }
        if (log.isDebugEnabled()) {
            log.debug("Round {}: community {} with {} playing seats", roundId, Card.format(communityCards),
                    results.size());
        }
        return new TableRoundResult(roundId, communityCards, lastDiscardedCards, results);
    }

    /**
     * Cards burned by the dealer in the last round; empty when discard is disabled.
     */
    public List<Card> lastDiscardedCards() {
        return lastDiscardedCards;
    }
}
