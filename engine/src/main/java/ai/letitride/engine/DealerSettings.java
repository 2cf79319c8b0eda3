package ai.letitride.engine;

/**
 * Dealer discard rule: some shuffling machines hand the dealer a batch of cards, and the extra
 * cards are burned before the community cards.
 */
public final class DealerSettings {
    public static final int MIN_DISCARD = 1;
    public static final int MAX_DISCARD = 10;
    public static final int DEFAULT_DISCARD = 3;

    /** No discard. */
    public static final DealerSettings DISABLED = new DealerSettings(false, DEFAULT_DISCARD);

    private final boolean discardEnabled;
    private final int discardCards;

    private DealerSettings(boolean discardEnabled, int discardCards) {
        this.discardEnabled = discardEnabled;
        this.discardCards = discardCards;
    }

    /**
     * @throws IllegalArgumentException if the discard count is outside 1–10
     */
    public static DealerSettings of(boolean discardEnabled, int discardCards) {
        if (discardCards < MIN_DISCARD || discardCards > MAX_DISCARD) {
            throw new IllegalArgumentException("Dealer discard must be between " + MIN_DISCARD + " and "
                    + MAX_DISCARD + " cards, got " + discardCards);
        }
        return discardEnabled ? new DealerSettings(true, discardCards) : DISABLED;
    }

    public boolean isDiscardEnabled() {
        return discardEnabled;
    }

    public int getDiscardCards() {
        return discardCards;
    }

    @Override
    public String toString() {
        return discardEnabled ? "DealerSettings(discard=" + discardCards + ")" : "DealerSettings(no discard)";
    }
}
