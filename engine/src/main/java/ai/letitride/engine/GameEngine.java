package ai.letitride.engine;

import ai.letitride.game.Card;
import ai.letitride.game.Deck;
import ai.letitride.paytable.BonusPaytable;
import ai.letitride.paytable.MainGamePaytable;
import ai.letitride.strategy.Strategy;
import ai.letitride.strategy.StrategyContext;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays single-player hands of Let It Ride.
 *
 * <p>Each hand runs the same fixed sequence against a freshly shuffled deck:
 * <ol>
 *     <li>reset and shuffle the deck with the engine's RNG</li>
 *     <li>burn the dealer discard, when enabled</li>
 *     <li>deal three player cards, then two community cards</li>
 *     <li>decide bet 1 and bet 2, evaluate, settle (see {@link HandSettlement})</li>
 * </ol>
 * An engine owns its deck and RNG, so it must only be used from one thread.
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Deck deck;
    private final Strategy strategy;
    private final MainGamePaytable mainPaytable;
    private final BonusPaytable bonusPaytable;
    private final Random rng;
    private final DealerSettings dealerSettings;
    private List<Card> lastDiscardedCards = List.of();

    public GameEngine(Deck deck, Strategy strategy, MainGamePaytable mainPaytable, BonusPaytable bonusPaytable,
                      Random rng) {
        this(deck, strategy, mainPaytable, bonusPaytable, rng, DealerSettings.DISABLED);
    }

    /**
     * @param bonusPaytable {@code null} when the bonus bet is not offered
     */
    public GameEngine(Deck deck, Strategy strategy, MainGamePaytable mainPaytable, BonusPaytable bonusPaytable,
                      Random rng, DealerSettings dealerSettings) {
        this.deck = Objects.requireNonNull(deck, "deck");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.mainPaytable = Objects.requireNonNull(mainPaytable, "mainPaytable");
        this.bonusPaytable = bonusPaytable;
        this.rng = Objects.requireNonNull(rng, "rng");
        this.dealerSettings = Objects.requireNonNull(dealerSettings, "dealerSettings");
    }

    public GameHandResult playHand(int handId, double baseBet) {
        return playHand(handId, baseBet, 0.0, StrategyContext.EMPTY);
    }

    /**
     * Plays one complete hand.
     *
     * @param handId   identifier carried into the result
     * @param baseBet  amount on each of the three circles
     * @param bonusBet Three Card Bonus stake, 0 for none
     * @param context  session state for the strategy, {@code null} for an empty context
     * @return the settled hand
     * @throws IllegalArgumentException for invalid stakes (see {@link HandSettlement#validateBets})
     */
    public GameHandResult playHand(int handId, double baseBet, double bonusBet, StrategyContext context) {
        HandSettlement.validateBets(baseBet, bonusBet, bonusPaytable);
        StrategyContext ctx = context != null ? context : StrategyContext.EMPTY;

        deck.reset();
        deck.shuffle(rng);

        lastDiscardedCards = dealerSettings.isDiscardEnabled()
                ? deck.deal(dealerSettings.getDiscardCards())
                : List.of();
        List<Card> playerCards = deck.deal(3);
        List<Card> communityCards = deck.deal(2);

        HandSettlement settlement = HandSettlement.settle(playerCards, communityCards, strategy, mainPaytable,
                bonusPaytable, baseBet, bonusBet, ctx);
        GameHandResult result = new GameHandResult(handId, playerCards, communityCards, baseBet, bonusBet, settlement);
        if (log.isDebugEnabled()) {
            log.debug("{}", result);
        }
        return result;
    }

    /**
     * Cards burned by the dealer in the last hand; empty when discard is disabled.
     */
    public List<Card> lastDiscardedCards() {
        return lastDiscardedCards;
    }
}
