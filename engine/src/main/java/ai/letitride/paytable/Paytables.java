package ai.letitride.paytable;

import ai.letitride.game.FiveCardHandRank;
import ai.letitride.game.ThreeCardHandRank;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for the paytables dealt in casinos.
 *
 * <p>Main game: the standard 1000/200/50/11/8/5/3/2/1 schedule. Three Card Bonus: variants A, B
 * (the common default) and C, the last with a configurable progressive Mini Royal payout.
 */
public final class Paytables {
    public static final String STANDARD = "standard";
    public static final String BONUS_A = "paytable_a";
    public static final String BONUS_B = "paytable_b";
    public static final String BONUS_C = "paytable_c";
    public static final int DEFAULT_PROGRESSIVE_PAYOUT = 1000;

    private Paytables() {
    }

    public static MainGamePaytable standard() {
        Map<FiveCardHandRank, Integer> m = new EnumMap<>(FiveCardHandRank.class);
        m.put(FiveCardHandRank.ROYAL_FLUSH, 1000);
        m.put(FiveCardHandRank.STRAIGHT_FLUSH, 200);
        m.put(FiveCardHandRank.FOUR_OF_A_KIND, 50);
        m.put(FiveCardHandRank.FULL_HOUSE, 11);
        m.put(FiveCardHandRank.FLUSH, 8);
        m.put(FiveCardHandRank.STRAIGHT, 5);
        m.put(FiveCardHandRank.THREE_OF_A_KIND, 3);
        m.put(FiveCardHandRank.TWO_PAIR, 2);
        m.put(FiveCardHandRank.PAIR_TENS_OR_BETTER, 1);
        m.put(FiveCardHandRank.PAIR_BELOW_TENS, 0);
        m.put(FiveCardHandRank.HIGH_CARD, 0);
        return new MainGamePaytable(STANDARD, m);
    }

    public static BonusPaytable paytableA() {
        return bonus(BONUS_A, 50, 40, 30, 6, 3, 1);
    }

    public static BonusPaytable paytableB() {
        return bonus(BONUS_B, 100, 40, 30, 5, 4, 1);
    }

    public static BonusPaytable paytableC(int progressivePayout) {
        return bonus(BONUS_C, progressivePayout, 200, 30, 6, 4, 1);
    }

    /**
     * Looks up a main game paytable by configuration name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static MainGamePaytable mainByName(String name) {
        if (STANDARD.equals(normalise(name))) {
            return standard();
        }
        throw new IllegalArgumentException("Unknown main paytable '" + name + "'");
    }

    /**
     * Looks up a bonus paytable by configuration name ({@code paytable_a}, {@code paytable_b},
     * {@code paytable_c}; the single letters {@code a}, {@code b}, {@code c} are accepted too).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static BonusPaytable bonusByName(String name, int progressivePayout) {
        switch (normalise(name)) {
            case BONUS_A:
            case "a":
                return paytableA();
            case BONUS_B:
            case "b":
                return paytableB();
            case BONUS_C:
            case "c":
                return paytableC(progressivePayout);
            default:
                throw new IllegalArgumentException("Unknown bonus paytable '" + name + "'");
        }
    }

    private static String normalise(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Paytable name is required");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static BonusPaytable bonus(String name, int miniRoyal, int straightFlush, int trips, int straight,
                                       int flush, int pair) {
        Map<ThreeCardHandRank, Integer> m = new EnumMap<>(ThreeCardHandRank.class);
        m.put(ThreeCardHandRank.MINI_ROYAL, miniRoyal);
        m.put(ThreeCardHandRank.STRAIGHT_FLUSH, straightFlush);
        m.put(ThreeCardHandRank.THREE_OF_A_KIND, trips);
        m.put(ThreeCardHandRank.STRAIGHT, straight);
        m.put(ThreeCardHandRank.FLUSH, flush);
        m.put(ThreeCardHandRank.PAIR, pair);
        m.put(ThreeCardHandRank.HIGH_CARD, 0);
        return new BonusPaytable(name, m);
    }
}
