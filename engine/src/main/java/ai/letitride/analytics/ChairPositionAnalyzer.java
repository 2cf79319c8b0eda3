package ai.letitride.analytics;

import ai.letitride.simulation.SeatSessionResult;
import ai.letitride.simulation.SessionResult;
import ai.letitride.simulation.TableSessionResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks whether the seat a player takes at a shared table changes how often sessions end ahead.
 * Session outcomes are grouped by seat and the win counts are tested against a uniform split with a
 * chi-square test.
 */
public final class ChairPositionAnalyzer {
    private final double confidenceLevel;
    private final double significanceLevel;

    public ChairPositionAnalyzer() {
        this(0.95, 0.05);
    }

    public ChairPositionAnalyzer(double confidenceLevel, double significanceLevel) {
        ConfidenceInterval.checkLevel(confidenceLevel);
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("Significance level must be between 0 and 1, got " + significanceLevel);
        }
        this.confidenceLevel = confidenceLevel;
        this.significanceLevel = significanceLevel;
    }

    /**
     * @throws IllegalArgumentException if there are no tables or no seats
     */
    public ChairPositionReport analyze(List<TableSessionResult> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Cannot analyze an empty list of table results");
        }
        Map<Integer, SeatTally> tallies = new TreeMap<>();
        for (TableSessionResult table : tables) {
            for (SeatSessionResult seat : table.getSeatResults()) {
                tallies.computeIfAbsent(seat.getSeatNumber(), n -> new SeatTally()).add(seat.getSessionResult());
            }
        }
        if (tallies.isEmpty()) {
            throw new IllegalArgumentException("No seat results found in the table results");
        }

        List<ChairPositionReport.SeatStatistics> seats = new ArrayList<>();
        tallies.forEach((seat, tally) -> seats.add(tally.toStatistics(seat, confidenceLevel)));
        return new ChairPositionReport(seats, testIndependence(seats));
    }

    private ChiSquareResult testIndependence(List<ChairPositionReport.SeatStatistics> seats) {
        if (seats.size() < 2) {
            return ChiSquareResult.untested();
        }
        long[] observed = new long[seats.size()];
        long totalWins = 0;
        for (int i = 0; i < observed.length; i++) {
            observed[i] = seats.get(i).getWins();
            totalWins += observed[i];
        }
        if (totalWins == 0) {
            return ChiSquareResult.untested();
        }
        double[] expected = new double[observed.length];
        Arrays.fill(expected, totalWins / (double) observed.length);
        return ChiSquareResult.test(expected, observed, significanceLevel);
    }

    private static final class SeatTally {
        private int wins;
        private int losses;
        private int pushes;
        private double totalProfit;

        void add(SessionResult session) {
            switch (session.getOutcome()) {
                case WIN:
                    wins++;
                    break;
                case LOSS:
                    losses++;
                    break;
                default:
                    pushes++;
            }
            totalProfit += session.getSessionProfit();
        }

        ChairPositionReport.SeatStatistics toStatistics(int seat, double level) {
            int total = wins + losses + pushes;
            return new ChairPositionReport.SeatStatistics(seat, wins, losses, pushes,
                    ConfidenceInterval.wilson(wins, total, level), totalProfit);
        }
    }
}
