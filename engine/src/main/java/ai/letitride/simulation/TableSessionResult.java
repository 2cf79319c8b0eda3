package ai.letitride.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a table session.
 *
 * <p>{@code seatResults} holds one entry per seat: the seat's only session at a classic table, or
 * its last session at a seat-replacement table. Seat-replacement tables also report every session
 * each seat went through in {@link #getSeatSessions()}.
 */
public final class TableSessionResult {
    private final List<SeatSessionResult> seatResults;
    private final int totalRounds;
    private final StopReason stopReason;
    private final Map<Integer, List<SeatSessionResult>> seatSessions;

    public TableSessionResult(List<SeatSessionResult> seatResults, int totalRounds, StopReason stopReason,
                              Map<Integer, List<SeatSessionResult>> seatSessions) {
        this.seatResults = List.copyOf(seatResults);
        this.totalRounds = totalRounds;
        this.stopReason = Objects.requireNonNull(stopReason, "stopReason");
        if (seatSessions == null) {
            this.seatSessions = null;
        } else {
            Map<Integer, List<SeatSessionResult>> copy = new LinkedHashMap<>();
            seatSessions.forEach((seat, sessions) -> copy.put(seat, List.copyOf(sessions)));
            this.seatSessions = Collections.unmodifiableMap(copy);
        }
    }

    public List<SeatSessionResult> getSeatResults() {
        return seatResults;
    }

    public int getTotalRounds() {
        return totalRounds;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    /** Present only for seat-replacement tables. */
    public Optional<Map<Integer, List<SeatSessionResult>>> getSeatSessions() {
        return Optional.ofNullable(seatSessions);
    }

    /**
     * Every session played at the table, seat by seat: the seat results at a classic table, all
     * seat sessions at a seat-replacement table.
     */
    public List<SessionResult> allSessionResults() {
        List<SessionResult> all = new ArrayList<>();
        if (seatSessions == null) {
            for (SeatSessionResult seat : seatResults) {
                all.add(seat.getSessionResult());
            }
        } else {
            for (List<SeatSessionResult> sessions : seatSessions.values()) {
                for (SeatSessionResult seat : sessions) {
                    all.add(seat.getSessionResult());
                }
            }
        }
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableSessionResult)) {
            return false;
        }
        TableSessionResult that = (TableSessionResult) o;
        return totalRounds == that.totalRounds && stopReason == that.stopReason
                && seatResults.equals(that.seatResults) && Objects.equals(seatSessions, that.seatSessions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seatResults, totalRounds, stopReason, seatSessions);
    }

    @Override
    public String toString() {
        return "TableSessionResult(rounds=" + totalRounds + ", stop=" + stopReason.token() + ", seats="
                + seatResults.size() + ")";
    }
}
