package ai.letitride.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable and interned: {@link #of(Rank, Suit)} always returns the same
 * instance for a given rank and suit, so the 52 cards of a deck are shared by every
 * deck and hand in the process.
 * <p>
 * Cards are ordered by rank only (see {@link #BY_RANK}). Two cards of the same rank and
 * different suits compare as equal under that ordering yet are not {@link #equals(Object) equal}.
 */
public final class Card {
    /** Orders cards by rank value, Ace high. Inconsistent with {@link #equals(Object)}. */
    public static final Comparator<Card> BY_RANK = Comparator.comparingInt(card -> card.rank.getValue());

    private static final Card[][] INTERNED = new Card[Suit.values().length][Rank.values().length];

    static {
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                INTERNED[suit.ordinal()][rank.ordinal()] = new Card(rank, suit);
            }
        }
    }

    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit (Clubs, Diamonds, Hearts, Spades) of this card. */
    private final Suit suit;

    private Card(Rank rank, Suit suit) {
        this.rank = rank;
        this.suit = suit;
    }

    /**
     * Returns the card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @return the interned card instance
     * @throws NullPointerException if rank or suit is null
     */
    public static Card of(Rank rank, Suit suit) {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
        return INTERNED[suit.ordinal()][rank.ordinal()];
    }

    /**
     * Parses the two character text form of a card, rank then suit (e.g., "Ah", "Tc", "9d").
     *
     * @param text the card text
     * @return the parsed card
     * @throws IllegalArgumentException if the text is not a valid card
     */
    public static Card parse(String text) {
        if (text == null || text.trim().length() != 2) {
            throw new IllegalArgumentException("Invalid card '" + text + "'");
        }
        String trimmed = text.trim();
        return of(Rank.fromSymbol(trimmed.charAt(0)), Suit.fromSymbol(trimmed.charAt(1)));
    }

    /**
     * Parses a whitespace separated list of cards, e.g. {@code "Ah Kd Qs"}.
     *
     * @param text the card list
     * @return the parsed cards in the order given
     */
    public static List<Card> parseAll(String text) {
        List<Card> cards = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return cards;
        }
        for (String token : text.trim().split("\\s+")) {
            cards.add(parse(token));
        }
        return cards;
    }

    /**
     * Formats cards as a single space separated string, e.g. {@code "Ah Kd Qs"}.
     *
     * @param cards the cards to format
     * @return the text form
     */
    public static String format(List<Card> cards) {
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(card.shortName());
        }
        return sb.toString();
    }

    /**
     * Returns an unmodifiable list of all 52 cards in canonical order
     * (suits clubs to spades, ranks two to ace within each suit).
     *
     * @return the canonical card order
     */
    public static List<Card> canonicalOrder() {
        List<Card> cards = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(INTERNED[suit.ordinal()][rank.ordinal()]);
            }
        }
        return Collections.unmodifiableList(cards);
    }

    /**
     * Returns the rank of this card.
     *
     * @return the rank (e.g., {@code Rank.ACE}, {@code Rank.KING})
     */
    public Rank getRank() {
        return rank;
    }

    /**
     * Returns the suit of this card.
     *
     * @return the suit (e.g., {@code Suit.SPADES}, {@code Suit.HEARTS})
     */
    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns the two character form of this card, rank symbol then suit symbol (e.g., "Ah", "Tc").
     *
     * @return the short name of the card
     */
    public String shortName() {
        return String.valueOf(rank.getSymbol()) + suit.getSymbol();
    }

    @Override
    public String toString() {
        return shortName();
    }

    /**
     * Two cards are equal if and only if they have the same rank and suit.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
