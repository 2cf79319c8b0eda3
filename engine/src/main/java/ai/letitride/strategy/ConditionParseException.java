package ai.letitride.strategy;

/**
 * A rule condition is empty, malformed, or names a field that does not exist.
 */
public class ConditionParseException extends StrategyDefinitionException {

    public ConditionParseException(String message) {
        super(message);
    }

    public ConditionParseException(String condition, String problem) {
        super("Invalid condition '" + condition + "': " + problem);
    }
}
