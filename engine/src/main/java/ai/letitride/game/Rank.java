package ai.letitride.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck.
 * <p>
 * Each rank carries a numeric value (2–14) used for poker ordering, with the Ace
 * ranked high. The Ace may also play low (value 1) when forming the wheel straight
 * (A-2-3-4-5) or the three-card A-2-3 straight; {@link #getLowValue()} exposes that value.
 */
public enum Rank {
    /** Two – rank value 2. */
    TWO(2, '2'),
    /** Three – rank value 3. */
    THREE(3, '3'),
    /** Four – rank value 4. */
    FOUR(4, '4'),
    /** Five – rank value 5. */
    FIVE(5, '5'),
    /** Six – rank value 6. */
    SIX(6, '6'),
    /** Seven – rank value 7. */
    SEVEN(7, '7'),
    /** Eight – rank value 8. */
    EIGHT(8, '8'),
    /** Nine – rank value 9. */
    NINE(9, '9'),
    /** Ten – rank value 10. */
    TEN(10, 'T'),
    /** Jack – rank value 11. */
    JACK(11, 'J'),
    /** Queen – rank value 12. */
    QUEEN(12, 'Q'),
    /** King – rank value 13. */
    KING(13, 'K'),
    /** Ace – the highest rank (value 14), low only inside wheel straights. */
    ACE(14, 'A');

    private static final Rank[] BY_VALUE = new Rank[15];

    static {
        for (Rank rank : values()) {
            BY_VALUE[rank.value] = rank;
        }
    }

    /** Numeric value of the rank, used for ordering and comparisons (2–14). */
    private final int value;
    /** Single character symbol (e.g., 'T', 'K', 'A'). */
    private final char symbol;

    Rank(int value, char symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    /**
     * Returns the numeric value of this rank with the Ace high.
     *
     * @return the rank value (2 for Two, 14 for Ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the value of this rank when the Ace plays low.
     *
     * @return 1 for the Ace, otherwise {@link #getValue()}
     */
    public int getLowValue() {
        return this == ACE ? 1 : value;
    }

    /**
     * Returns the single character symbol of this rank.
     *
     * @return the symbol (e.g., '9', 'T', 'A')
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns {@code true} for Ten, Jack, Queen, King and Ace.
     *
     * @return whether this rank counts as a high card
     */
    public boolean isHigh() {
        return value >= TEN.value;
    }

    /**
     * Compares two ranks with the Ace playing low. Only meaningful for wheel detection.
     *
     * @param a first rank
     * @param b second rank
     * @return negative, zero or positive as {@code a} is lower, equal or higher than {@code b}
     */
    public static int compareAceLow(Rank a, Rank b) {
        return Integer.compare(a.getLowValue(), b.getLowValue());
    }

    /**
     * Looks up a rank by its Ace-high value.
     *
     * @param value the rank value (2–14)
     * @return the matching rank
     * @throws IllegalArgumentException if no rank has this value
     */
    public static Rank fromValue(int value) {
        if (value < 2 || value > 14) {
            throw new IllegalArgumentException("No rank with value " + value);
        }
        return BY_VALUE[value];
    }

    /**
     * Looks up a rank by its symbol (case-insensitive).
     *
     * @param symbol the rank symbol (e.g., 'T', 'q', '7')
     * @return the matching rank
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static Rank fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Rank rank : values()) {
            if (rank.symbol == upper) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank symbol '" + symbol + "'");
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
