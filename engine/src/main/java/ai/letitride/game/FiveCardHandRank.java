package ai.letitride.game;

import java.util.Comparator;
import java.util.Locale;

/**
 * Final five-card hand categories paid by the main game.
 * <p>
 * A pair is split at tens because Let It Ride pays only tens or better. Each constant carries an
 * explicit strength; compare hands through {@link #getStrength()} or {@link #BY_STRENGTH}, never
 * through {@link #ordinal()}.
 */
public enum FiveCardHandRank {
    HIGH_CARD(0),
    PAIR_BELOW_TENS(1),
    PAIR_TENS_OR_BETTER(2),
    TWO_PAIR(3),
    THREE_OF_A_KIND(4),
    STRAIGHT(5),
    FLUSH(6),
    FULL_HOUSE(7),
    FOUR_OF_A_KIND(8),
    STRAIGHT_FLUSH(9),
    ROYAL_FLUSH(10);

    public static final Comparator<FiveCardHandRank> BY_STRENGTH =
            Comparator.comparingInt(FiveCardHandRank::getStrength);

    private final int strength;

    FiveCardHandRank(int strength) {
        this.strength = strength;
    }

    public int getStrength() {
        return strength;
    }

    public boolean beats(FiveCardHandRank other) {
        return strength > other.strength;
    }

    /**
     * Lower-case name used in hand records and paytable configuration (e.g., "flush").
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FiveCardHandRank fromWireName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
