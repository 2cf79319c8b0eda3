package ai.letitride.strategy;

/**
 * Base type for errors in a strategy definition. Raised when a strategy is built, never mid-session.
 */
public class StrategyDefinitionException extends IllegalArgumentException {

    public StrategyDefinitionException(String message) {
        super(message);
    }
}
