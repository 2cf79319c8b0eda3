package ai.letitride.simulation;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A table session: the per-seat session settings, the seat count and, for seat-replacement tables,
 * the number of rounds the table runs.
 */
public final class TableSessionConfig {
    private final SessionConfig seatConfig;
    private final int numSeats;
    private final Integer tableTotalRounds;

    /**
     * @param seatConfig       stakes and stop conditions shared by every seat
     * @param numSeats         seats at the table (at least 1)
     * @param tableTotalRounds rounds to run in seat-replacement mode, {@code null} for classic mode
     * @throws IllegalArgumentException for a non-positive seat count or round count
     */
    public TableSessionConfig(SessionConfig seatConfig, int numSeats, Integer tableTotalRounds) {
        this.seatConfig = Objects.requireNonNull(seatConfig, "seatConfig");
        if (numSeats < 1) {
            throw new IllegalArgumentException("A table needs at least one seat, got " + numSeats);
        }
        if (tableTotalRounds != null && tableTotalRounds <= 0) {
            throw new IllegalArgumentException("Table total rounds must be positive if set, got " + tableTotalRounds);
        }
        this.numSeats = numSeats;
        this.tableTotalRounds = tableTotalRounds;
    }

    public SessionConfig getSeatConfig() {
        return seatConfig;
    }

    public int getNumSeats() {
        return numSeats;
    }

    public OptionalInt getTableTotalRounds() {
        return tableTotalRounds == null ? OptionalInt.empty() : OptionalInt.of(tableTotalRounds);
    }

    public boolean isSeatReplacement() {
        return tableTotalRounds != null;
    }
}
