package ai.letitride.analytics;

import ai.letitride.simulation.AggregateStatistics;
import ai.letitride.simulation.SessionResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Confidence intervals, distribution shape and loss risk for a finished run.
 */
public final class StatisticsCalculator {
    public static final List<Integer> DEFAULT_PERCENTILES = List.of(5, 25, 50, 75, 95);

    private StatisticsCalculator() {
    }

    /**
     * @param sessions the individual sessions behind {@code stats}; they supply the per-hand EV
     *                 interval and drawdowns, and may be empty
     * @throws IllegalArgumentException if {@code stats} has no sessions
     */
    public static DetailedStatistics calculate(AggregateStatistics stats, List<SessionResult> sessions,
                                               double confidenceLevel) {
        if (stats.getTotalSessions() <= 0 || stats.getSessionProfits().isEmpty()) {
            throw new IllegalArgumentException("Cannot calculate statistics without sessions");
        }
        ConfidenceInterval winRate = ConfidenceInterval.wilson(stats.getWinningSessions(), stats.getTotalSessions(),
                confidenceLevel);

        double[] evs;
        if (sessions.isEmpty()) {
            evs = new double[] {stats.getExpectedValuePerHand()};
        } else {
            evs = new double[sessions.size()];
            for (int i = 0; i < evs.length; i++) {
                SessionResult session = sessions.get(i);
                evs[i] = session.getHandsPlayed() > 0 ? session.getSessionProfit() / session.getHandsPlayed() : 0.0;
            }
        }
        ConfidenceInterval ev = ConfidenceInterval.mean(evs, confidenceLevel);

        double[] profits = stats.getSessionProfits().stream().mapToDouble(Double::doubleValue).toArray();
        double startingBankroll = sessions.isEmpty() ? 0.0 : sessions.get(0).getStartingBankroll();
        return new DetailedStatistics(stats.getSessionWinRate(), winRate, stats.getExpectedValuePerHand(), ev,
                distribution(profits), riskMetrics(profits, sessions, startingBankroll));
    }

    public static DetailedStatistics calculate(AggregateStatistics stats, List<SessionResult> sessions) {
        return calculate(stats, sessions, 0.95);
    }

    /**
     * @throws IllegalArgumentException if {@code data} is empty
     */
    static DetailedStatistics.Distribution distribution(double[] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot describe an empty sample");
        }
        DescriptiveStatistics descriptive = new DescriptiveStatistics(data);
        int n = data.length;
        double std = n > 1 ? descriptive.getStandardDeviation() : 0.0;
        double variance = n > 1 ? descriptive.getVariance() : 0.0;
        double skewness = n < 3 || std == 0 ? 0.0 : descriptive.getSkewness();
        double kurtosis = n < 4 || std == 0 ? 0.0 : descriptive.getKurtosis();

        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_6);
        for (int p : DEFAULT_PERCENTILES) {
            percentiles.put(p, n == 1 ? data[0] : estimator.evaluate(data, p));
        }
        return new DetailedStatistics.Distribution(descriptive.getMean(), std, variance, skewness, kurtosis,
                descriptive.getMin(), descriptive.getMax(), percentiles);
    }

    private static DetailedStatistics.RiskMetrics riskMetrics(double[] profits, List<SessionResult> sessions,
                                                              double startingBankroll) {
        int n = profits.length;
        int anyLoss = 0;
        int halfLoss = 0;
        int fullLoss = 0;
        for (double profit : profits) {
            if (profit < 0) {
                anyLoss++;
            }
            if (startingBankroll > 0 && profit <= -0.5 * startingBankroll) {
                halfLoss++;
            }
            if (startingBankroll > 0 && profit <= -startingBankroll) {
                fullLoss++;
            }
        }
        double drawdownMean = 0.0;
        double drawdownStd = 0.0;
        if (!sessions.isEmpty()) {
            DescriptiveStatistics drawdowns = new DescriptiveStatistics();
            for (SessionResult session : sessions) {
                drawdowns.addValue(session.getMaxDrawdown());
            }
            drawdownMean = drawdowns.getMean();
            drawdownStd = sessions.size() > 1 ? drawdowns.getStandardDeviation() : 0.0;
        }
        return new DetailedStatistics.RiskMetrics(anyLoss / (double) n, halfLoss / (double) n,
                fullLoss / (double) n, drawdownMean, drawdownStd);
    }
}
