package ai.letitride.game;

/**
 * Thrown when a deal asks for more cards than remain in the deck.
 * The deck is left untouched when this is raised.
 */
public class InsufficientCardsException extends IllegalStateException {

    private final int requested;
    private final int remaining;

    public InsufficientCardsException(int requested, int remaining) {
        super("Cannot deal " + requested + " cards, only " + remaining + " remaining");
        this.requested = requested;
        this.remaining = remaining;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemaining() {
        return remaining;
    }
}
