package ai.letitride.bankroll;

import java.util.Locale;
import java.util.Objects;

/**
 * How much to stake on the Three Card Bonus each hand: nothing, a fixed amount, a ratio of the base
 * bet, or an amount that depends on how the session is going ({@link ConditionalBonus}).
 */
public final class BonusBetPolicy {
    public static final String NEVER = "never";
    public static final String FIXED = "fixed";
    public static final String RATIO = "ratio";
    public static final String BANKROLL_CONDITIONAL = "bankroll_conditional";

    private static final BonusBetPolicy NONE = new BonusBetPolicy(NEVER, 0.0, null);

    private final String type;
    private final double value;
    private final ConditionalBonus conditions;

    private BonusBetPolicy(String type, double value, ConditionalBonus conditions) {
        this.type = type;
        this.value = value;
        this.conditions = conditions;
    }

    public static BonusBetPolicy never() {
        return NONE;
    }

    /**
     * @throws IllegalArgumentException if the amount is negative
     */
    public static BonusBetPolicy fixed(double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Bonus amount cannot be negative, got " + amount);
        }
        return amount == 0 ? NONE : new BonusBetPolicy(FIXED, amount, null);
    }

    /**
     * @throws IllegalArgumentException if the ratio is negative
     */
    public static BonusBetPolicy ratio(double ratio) {
        if (ratio < 0) {
            throw new IllegalArgumentException("Bonus ratio cannot be negative, got " + ratio);
        }
        return ratio == 0 ? NONE : new BonusBetPolicy(RATIO, ratio, null);
    }

    public static BonusBetPolicy conditional(ConditionalBonus conditions) {
        return new BonusBetPolicy(BANKROLL_CONDITIONAL, 0.0, Objects.requireNonNull(conditions, "conditions"));
    }

    /**
     * Builds a policy from configuration: {@code never}, {@code fixed} (alias {@code always}) or {@code ratio}.
     */
    public static BonusBetPolicy of(String type, double amount, double ratio) {
        return of(type, amount, ratio, null);
    }

    /**
     * As {@link #of(String, double, double)}, also accepting {@code bankroll_conditional}.
     *
     * @param conditions required for {@code bankroll_conditional}, ignored otherwise
     */
    public static BonusBetPolicy of(String type, double amount, double ratio, ConditionalBonus conditions) {
        if (type == null) {
            return NONE;
        }
        switch (type.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case NEVER:
                return NONE;
            case FIXED:
            case "always":
                return fixed(amount);
            case RATIO:
                return ratio(ratio);
            case BANKROLL_CONDITIONAL:
            case "conditional":
                if (conditions == null) {
                    throw new IllegalArgumentException("Bonus policy '" + type + "' needs conditional settings");
                }
                return conditional(conditions);
            default:
                throw new IllegalArgumentException("Unknown bonus policy '" + type + "'");
        }
    }

    /**
     * The stake every hand must be able to cover. A conditional policy reserves nothing; its stake is
     * decided per hand by {@link #bonusBet(double, BettingContext)}.
     *
     * @return the bonus stake for a hand with this base bet
     */
    public double bonusBet(double baseBet) {
        switch (type) {
            case FIXED:
                return value;
            case RATIO:
                return baseBet * value;
            default:
                return 0.0;
        }
    }

    /**
     * @return the bonus stake for the next hand given the session state
     */
    public double bonusBet(double baseBet, BettingContext context) {
        return isConditional() ? conditions.bonusBet(context) : bonusBet(baseBet);
    }

    public boolean isActive() {
        return NONE != this;
    }

    public boolean isConditional() {
        return conditions != null;
    }

    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        if (isConditional()) {
            return "BonusBetPolicy(" + conditions + ")";
        }
        return isActive() ? "BonusBetPolicy(" + type + "=" + value + ")" : "BonusBetPolicy(never)";
    }
}
