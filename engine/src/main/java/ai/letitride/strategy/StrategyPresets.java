package ai.letitride.strategy;

import java.util.List;

/**
 * Ready-made rule lists for the {@code conservative} and {@code aggressive} strategy types.
 */
public final class StrategyPresets {

    private StrategyPresets() {
    }

    /** Rides only hands that already pay. */
    public static CustomStrategy conservative() {
        List<StrategyRule> rules = List.of(
                StrategyRule.of("has_paying_hand", Decision.RIDE),
                StrategyRule.of(ConditionCompiler.DEFAULT, Decision.PULL));
        return new CustomStrategy(rules, rules);
    }

    /** Rides paying hands plus any flush or straight draw. */
    public static CustomStrategy aggressive() {
        List<StrategyRule> rules = List.of(
                StrategyRule.of("has_paying_hand", Decision.RIDE),
                StrategyRule.of("is_flush_draw", Decision.RIDE),
                StrategyRule.of("is_straight_draw", Decision.RIDE),
                StrategyRule.of(ConditionCompiler.DEFAULT, Decision.PULL));
        return new CustomStrategy(rules, rules);
    }
}
