package ai.letitride.strategy;

import java.util.Objects;

/**
 * One line of a custom strategy: when {@code condition} holds, take {@code action}.
 * The condition is kept as text here and compiled by {@link CustomStrategy}.
 */
public final class StrategyRule {
    private final String condition;
    private final Decision action;

    public StrategyRule(String condition, Decision action) {
        this.condition = condition;
        this.action = Objects.requireNonNull(action, "action");
    }

    public static StrategyRule of(String condition, Decision action) {
        return new StrategyRule(condition, action);
    }

    public String getCondition() {
        return condition;
    }

    public Decision getAction() {
        return action;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StrategyRule)) {
            return false;
        }
        StrategyRule that = (StrategyRule) o;
        return Objects.equals(condition, that.condition) && action == that.action;
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, action);
    }

    @Override
    public String toString() {
        return condition + " -> " + action;
    }
}
