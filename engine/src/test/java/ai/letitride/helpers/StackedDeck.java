package ai.letitride.helpers;

import ai.letitride.game.Card;
import ai.letitride.game.Deck;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A rigged deck for deterministic scenarios.
 *
 * <p>The given cards are dealt first, in order, followed by the rest of the deck in canonical
 * order. Shuffling is a no-op, so every hand played from this deck deals the same cards.
 */
public class StackedDeck extends Deck {

    public StackedDeck(String topCards) {
        super(order(topCards));
    }

    private static List<Card> order(String topCards) {
        Set<Card> order = new LinkedHashSet<>(Card.parseAll(topCards));
        order.addAll(Card.canonicalOrder());
        return new ArrayList<>(order);
    }

    @Override
    public void shuffle(Random rng) {
        // stacked: keep the order
    }
}
