package ai.letitride.simulation;

/**
 * Why a session (or a whole table) stopped.
 */
public enum StopReason {
    /** Session profit reached the win limit. */
    WIN_LIMIT("win_limit"),
    /** Session loss reached the loss limit. */
    LOSS_LIMIT("loss_limit"),
    /** The configured number of hands was played. */
    MAX_HANDS("max_hands"),
    /** The bankroll can no longer cover three base bets plus the bonus bet. */
    INSUFFICIENT_FUNDS("insufficient_funds"),
    /** A seat-replacement table played its configured number of rounds. */
    TABLE_ROUNDS_COMPLETE("table_rounds_complete"),
    /** A seat's session was still running when its table finished. */
    IN_PROGRESS("in_progress");

    private final String token;

    StopReason(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
