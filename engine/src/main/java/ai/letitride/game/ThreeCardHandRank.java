package ai.letitride.game;

import java.util.Comparator;
import java.util.Locale;

/**
 * Three-card categories paid by the Three Card Bonus side bet.
 * <p>
 * In three-card poker a straight is rarer than a flush and outranks it. Compare through
 * {@link #getStrength()}.
 */
public enum ThreeCardHandRank {
    HIGH_CARD(1),
    PAIR(2),
    FLUSH(3),
    STRAIGHT(4),
    THREE_OF_A_KIND(5),
    STRAIGHT_FLUSH(6),
    MINI_ROYAL(7);

    public static final Comparator<ThreeCardHandRank> BY_STRENGTH =
            Comparator.comparingInt(ThreeCardHandRank::getStrength);

    private final int strength;

    ThreeCardHandRank(int strength) {
        this.strength = strength;
    }

    public int getStrength() {
        return strength;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ThreeCardHandRank fromWireName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
