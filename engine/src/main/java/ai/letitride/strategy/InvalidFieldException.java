package ai.letitride.strategy;

/**
 * A known field is used as the wrong type, e.g. a flag compared with a number or a count used as a flag.
 */
public class InvalidFieldException extends StrategyDefinitionException {
    private final String field;

    public InvalidFieldException(String condition, String field, String problem) {
        super("Invalid use of field '" + field + "' in condition '" + condition + "': " + problem);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
