package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * The closed vocabulary of hand features a custom rule may reference, with direct accessors so a
 * compiled condition never looks a field up by name.
 */
public enum HandField {
    HIGH_CARDS("high_cards", HandAnalysis::getHighCards),
    SUITED_CARDS("suited_cards", HandAnalysis::getSuitedCards),
    CONNECTED_CARDS("connected_cards", HandAnalysis::getConnectedCards),
    GAPS("gaps", HandAnalysis::getGaps),
    SUITED_HIGH_CARDS("suited_high_cards", HandAnalysis::getSuitedHighCards),
    STRAIGHT_FLUSH_SPREAD("straight_flush_spread", HandAnalysis::getStraightFlushSpread),

    HAS_PAYING_HAND("has_paying_hand", HandAnalysis::hasPayingHand),
    HAS_PAIR("has_pair", HandAnalysis::hasPair),
    HAS_HIGH_PAIR("has_high_pair", HandAnalysis::hasHighPair),
    HAS_TRIPS("has_trips", HandAnalysis::hasTrips),
    IS_FLUSH_DRAW("is_flush_draw", HandAnalysis::isFlushDraw),
    IS_STRAIGHT_DRAW("is_straight_draw", HandAnalysis::isStraightDraw),
    IS_OPEN_STRAIGHT_DRAW("is_open_straight_draw", HandAnalysis::isOpenStraightDraw),
    IS_INSIDE_STRAIGHT_DRAW("is_inside_straight_draw", HandAnalysis::isInsideStraightDraw),
    IS_STRAIGHT_FLUSH_DRAW("is_straight_flush_draw", HandAnalysis::isStraightFlushDraw),
    IS_ROYAL_DRAW("is_royal_draw", HandAnalysis::isRoyalDraw),
    IS_EXCLUDED_SF_CONSECUTIVE("is_excluded_sf_consecutive", HandAnalysis::isExcludedStraightFlushConsecutive);

    private static final Map<String, HandField> BY_NAME = new HashMap<>();

    static {
        for (HandField field : values()) {
            BY_NAME.put(field.fieldName, field);
        }
    }

    private final String fieldName;
    private final ToIntFunction<HandAnalysis> numeric;
    private final Predicate<HandAnalysis> flag;

    HandField(String fieldName, ToIntFunction<HandAnalysis> numeric) {
        this.fieldName = fieldName;
        this.numeric = numeric;
        this.flag = null;
    }

    HandField(String fieldName, Predicate<HandAnalysis> flag) {
        this.fieldName = fieldName;
        this.numeric = null;
        this.flag = flag;
    }

    public String fieldName() {
        return fieldName;
    }

    public boolean isNumeric() {
        return numeric != null;
    }

    public ToIntFunction<HandAnalysis> numericAccessor() {
        if (numeric == null) {
            throw new IllegalStateException(fieldName + " is a boolean field");
        }
        return numeric;
    }

    public Predicate<HandAnalysis> flagAccessor() {
        if (flag == null) {
            throw new IllegalStateException(fieldName + " is a numeric field");
        }
        return flag;
    }

    public static Optional<HandField> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
