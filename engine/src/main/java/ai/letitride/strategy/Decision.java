package ai.letitride.strategy;

import java.util.Locale;

/**
 * What the player does with one of the two pullable bets.
 */
public enum Decision {
    /** Take the bet back before the next card is revealed. */
    PULL("pull"),
    /** Leave the bet in action. */
    RIDE("ride");

    private final String token;

    Decision(String token) {
        this.token = token;
    }

    /** Lower-case form used in rules and hand records. */
    public String token() {
        return token;
    }

    public static Decision fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        String normalised = token.trim().toLowerCase(Locale.ROOT);
        for (Decision decision : values()) {
            if (decision.token.equals(normalised)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Invalid decision '" + token + "', expected 'ride' or 'pull'");
    }

    @Override
    public String toString() {
        return token;
    }
}
