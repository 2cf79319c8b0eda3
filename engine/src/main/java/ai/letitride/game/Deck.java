package ai.letitride.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * A standard 52-card deck dealt once per hand.
 * <p>
 * The cards live in a single array: the first {@code dealtCount} slots hold the cards dealt so
 * far (in deal order) and the rest hold the cards still available. Dealing only moves the
 * boundary, so {@code cardsRemaining() + dealtCount() == 52} always holds and a reset costs a
 * single array copy.
 * <p>
 * Unlike a casino shoe the deck never shuffles itself: callers {@link #reset()} and then
 * {@link #shuffle(Random)} with the RNG that owns the simulation unit, which keeps every hand a
 * deterministic function of that RNG.
 */
public class Deck {
    public static final int SIZE = 52;

    /** Order the deck returns to on {@link #reset()}. */
    private final Card[] initialOrder;
    /** Dealt prefix followed by the remaining cards. */
    private final Card[] cards;
    private int dealtCount;

    /**
     * Constructs a deck in canonical order with all 52 cards available.
     */
    public Deck() {
        this(Card.canonicalOrder());
    }

    /**
     * Constructs a deck whose reset order is the given permutation of the 52 cards.
     *
     * @param order all 52 distinct cards, in the order the deck starts from
     * @throws IllegalArgumentException if the list is not a permutation of a full deck
     */
    public Deck(List<Card> order) {
        Objects.requireNonNull(order, "order");
        Set<Card> distinct = new HashSet<>(order);
        if (order.size() != SIZE || distinct.size() != SIZE) {
            throw new IllegalArgumentException("A deck needs exactly 52 distinct cards, got " + order.size()
                    + " (" + distinct.size() + " distinct)");
        }
        this.initialOrder = order.toArray(new Card[0]);
        this.cards = Arrays.copyOf(initialOrder, SIZE);
    }

    /**
     * Returns every card to the deck in its initial order. Does not shuffle.
     */
    public void reset() {
        System.arraycopy(initialOrder, 0, cards, 0, SIZE);
        dealtCount = 0;
    }

    /**
     * Shuffles the remaining cards in place with a Fisher–Yates pass driven by {@code rng}.
     * Cards already dealt are not touched.
     *
     * @param rng the random source of the current simulation unit
     */
    public void shuffle(Random rng) {
        for (int i = SIZE - 1; i > dealtCount; i--) {
            int j = dealtCount + rng.nextInt(i - dealtCount + 1);
            Card tmp = cards[i];
            cards[i] = cards[j];
            cards[j] = tmp;
        }
    }

    /**
     * Deals {@code count} cards from the top of the remaining cards.
     * <p>
     * The operation is atomic: either all cards move to the dealt pile or, when too few
     * remain, an {@link InsufficientCardsException} is thrown and the deck is unchanged.
     *
     * @param count number of cards to deal (at least 1)
     * @return the dealt cards in deal order
     * @throws IllegalArgumentException if {@code count < 1}
     * @throws InsufficientCardsException if fewer than {@code count} cards remain
     */
    public List<Card> deal(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Must deal at least 1 card, got " + count);
        }
        int remaining = cardsRemaining();
        if (count > remaining) {
            throw new InsufficientCardsException(count, remaining);
        }
        List<Card> hand = Collections.unmodifiableList(
                Arrays.asList(Arrays.copyOfRange(cards, dealtCount, dealtCount + count)));
        dealtCount += count;
        return hand;
    }

    /**
     * Returns the number of cards still available to deal.
     *
     * @return cards remaining (0–52)
     */
    public int cardsRemaining() {
        return SIZE - dealtCount;
    }

    /**
     * Returns the number of cards dealt since the last reset.
     *
     * @return cards dealt (0–52)
     */
    public int dealtCount() {
        return dealtCount;
    }

    /**
     * Returns a copy of the dealt cards in deal order.
     *
     * @return the dealt cards
     */
    public List<Card> dealtCards() {
        return new ArrayList<>(Arrays.asList(cards).subList(0, dealtCount));
    }

    @Override
    public String toString() {
        return "Deck(remaining=" + cardsRemaining() + ", dealt=" + dealtCount + ")";
    }
}
