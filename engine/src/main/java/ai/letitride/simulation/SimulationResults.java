package ai.letitride.simulation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything a simulation run produced, in unit order.
 *
 * <p>For table runs {@code sessionResults} lists every seat session of unit 0, then unit 1, and so
 * on; {@code tableResults} keeps the per-table view.
 */
public final class SimulationResults {
    private final SimulationSettings settings;
    private final long seed;
    private final List<SessionResult> sessionResults;
    private final List<TableSessionResult> tableResults;
    private final long totalHands;
    private final Instant startTime;
    private final Instant endTime;
    private final AggregateStatistics statistics;

    public SimulationResults(SimulationSettings settings, long seed, List<SessionResult> sessionResults,
                             List<TableSessionResult> tableResults, Instant startTime, Instant endTime,
                             AggregateStatistics statistics) {
        this.settings = settings;
        this.seed = seed;
        this.sessionResults = List.copyOf(sessionResults);
        this.tableResults = List.copyOf(tableResults);
        long hands = 0;
        for (SessionResult result : sessionResults) {
            hands += result.getHandsPlayed();
        }
        this.totalHands = hands;
        this.startTime = startTime;
        this.endTime = endTime;
        this.statistics = statistics;
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    /** The global seed actually used, configured or generated. */
    public long getSeed() {
        return seed;
    }

    public List<SessionResult> getSessionResults() {
        return sessionResults;
    }

    /** Empty unless the run played table sessions. */
    public List<TableSessionResult> getTableResults() {
        return tableResults;
    }

    public long getTotalHands() {
        return totalHands;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public AggregateStatistics getStatistics() {
        return statistics;
    }
}
