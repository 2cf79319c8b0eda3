package ai.letitride.game;

/**
 * The four suits of a standard deck. Suits carry no ordering semantics in poker;
 * only equality matters (flush detection).
 */
public enum Suit {
    CLUBS('c'),
    DIAMONDS('d'),
    HEARTS('h'),
    SPADES('s');

    /** Lower-case symbol used in the two character card text form (e.g., "Ah"). */
    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the lower-case symbol of this suit.
     *
     * @return 'c', 'd', 'h' or 's'
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Looks up a suit by its symbol (case-insensitive).
     *
     * @param symbol the suit symbol
     * @return the matching suit
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static Suit fromSymbol(char symbol) {
        char lower = Character.toLowerCase(symbol);
        for (Suit suit : values()) {
            if (suit.symbol == lower) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit symbol '" + symbol + "'");
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
