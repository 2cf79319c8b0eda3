package ai.letitride.strategy;

import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link Strategy} from its configuration name.
 *
 * <p>Known types: {@code basic}, {@code always_ride}, {@code always_pull}, {@code conservative},
 * {@code aggressive} and {@code custom} (which needs both rule lists).
 */
public final class StrategyFactory {
    public static final String BASIC = "basic";
    public static final String ALWAYS_RIDE = "always_ride";
    public static final String ALWAYS_PULL = "always_pull";
    public static final String CONSERVATIVE = "conservative";
    public static final String AGGRESSIVE = "aggressive";
    public static final String CUSTOM = "custom";

    private StrategyFactory() {
    }

    public static Strategy create(String type) {
        return create(type, List.of(), List.of());
    }

    /**
     * @throws IllegalArgumentException for an unknown type
     * @throws StrategyDefinitionException for invalid custom rules
     */
    public static Strategy create(String type, List<StrategyRule> bet1Rules, List<StrategyRule> bet2Rules) {
        if (type == null) {
            throw new IllegalArgumentException("Strategy type is required");
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case BASIC:
                return new BasicStrategy();
            case ALWAYS_RIDE:
                return new AlwaysRideStrategy();
            case ALWAYS_PULL:
                return new AlwaysPullStrategy();
            case CONSERVATIVE:
                return StrategyPresets.conservative();
            case AGGRESSIVE:
                return StrategyPresets.aggressive();
            case CUSTOM:
                return new CustomStrategy(bet1Rules, bet2Rules);
            default:
                throw new IllegalArgumentException("Unknown strategy type '" + type + "'");
        }
    }
}
