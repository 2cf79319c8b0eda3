package ai.letitride.paytable;

/**
 * Raised when a paytable does not price every hand category or prices one negatively.
 */
public class PaytableValidationException extends IllegalArgumentException {

    public PaytableValidationException(String message) {
        super(message);
    }
}
