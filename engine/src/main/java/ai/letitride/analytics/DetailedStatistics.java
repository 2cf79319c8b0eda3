package ai.letitride.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interval estimates and distribution figures for a run. Built by {@link StatisticsCalculator}.
 */
public final class DetailedStatistics {
    private final double sessionWinRate;
    private final ConfidenceInterval sessionWinRateInterval;
    private final double expectedValuePerHand;
    private final ConfidenceInterval expectedValueInterval;
    private final Distribution sessionProfits;
    private final RiskMetrics risk;

    DetailedStatistics(double sessionWinRate, ConfidenceInterval sessionWinRateInterval, double expectedValuePerHand,
                       ConfidenceInterval expectedValueInterval, Distribution sessionProfits, RiskMetrics risk) {
        this.sessionWinRate = sessionWinRate;
        this.sessionWinRateInterval = sessionWinRateInterval;
        this.expectedValuePerHand = expectedValuePerHand;
        this.expectedValueInterval = expectedValueInterval;
        this.sessionProfits = sessionProfits;
        this.risk = risk;
    }

    public double getSessionWinRate() {
        return sessionWinRate;
    }

    /** Wilson interval for the session win rate. */
    public ConfidenceInterval getSessionWinRateInterval() {
        return sessionWinRateInterval;
    }

    public double getExpectedValuePerHand() {
        return expectedValuePerHand;
    }

    /** Student-t interval over the per-session profit per hand. */
    public ConfidenceInterval getExpectedValueInterval() {
        return expectedValueInterval;
    }

    public Distribution getSessionProfits() {
        return sessionProfits;
    }

    public RiskMetrics getRisk() {
        return risk;
    }

    @Override
    public String toString() {
        return "DetailedStatistics{winRate=" + sessionWinRate + " " + sessionWinRateInterval + ", ev="
                + expectedValuePerHand + " " + expectedValueInterval + ", profits=" + sessionProfits + ", risk="
                + risk + '}';
    }

    /**
     * Shape of a sample. Standard deviation and variance are sample (n - 1) figures, skewness and
     * kurtosis the bias-corrected sample estimates (excess kurtosis, so 0 for a normal sample).
     * Percentiles interpolate at {@code p * (n + 1)}.
     */
    public static final class Distribution {
        private final double mean;
        private final double std;
        private final double variance;
        private final double skewness;
        private final double kurtosis;
        private final double min;
        private final double max;
        private final Map<Integer, Double> percentiles;

        Distribution(double mean, double std, double variance, double skewness, double kurtosis, double min,
                     double max, Map<Integer, Double> percentiles) {
            this.mean = mean;
            this.std = std;
            this.variance = variance;
            this.skewness = skewness;
            this.kurtosis = kurtosis;
            this.min = min;
            this.max = max;
            this.percentiles = Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
        }

        public double getMean() {
            return mean;
        }

        public double getStd() {
            return std;
        }

        public double getVariance() {
            return variance;
        }

        public double getSkewness() {
            return skewness;
        }

        public double getKurtosis() {
            return kurtosis;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }

        public Map<Integer, Double> getPercentiles() {
            return percentiles;
        }

        public double percentile(int p) {
            Double value = percentiles.get(p);
            if (value == null) {
                throw new IllegalArgumentException("Percentile " + p + " was not computed");
            }
            return value;
        }

        /** Interquartile range, the 75th less the 25th percentile. */
        public double getIqr() {
            return percentile(75) - percentile(25);
        }

        @Override
        public String toString() {
            return String.format("mean %.2f std %.2f skew %.3f kurt %.3f range [%.2f, %.2f] percentiles %s", mean,
                    std, skewness, kurtosis, min, max, percentiles);
        }
    }

    /**
     * How often sessions lost money, half the starting bankroll or all of it, and the drawdowns seen.
     */
    public static final class RiskMetrics {
        private final double probabilityOfAnyLoss;
        private final double probabilityOfHalfLoss;
        private final double probabilityOfTotalLoss;
        private final double maxDrawdownMean;
        private final double maxDrawdownStd;

        RiskMetrics(double probabilityOfAnyLoss, double probabilityOfHalfLoss, double probabilityOfTotalLoss,
                    double maxDrawdownMean, double maxDrawdownStd) {
            this.probabilityOfAnyLoss = probabilityOfAnyLoss;
            this.probabilityOfHalfLoss = probabilityOfHalfLoss;
            this.probabilityOfTotalLoss = probabilityOfTotalLoss;
            this.maxDrawdownMean = maxDrawdownMean;
            this.maxDrawdownStd = maxDrawdownStd;
        }

        public double getProbabilityOfAnyLoss() {
            return probabilityOfAnyLoss;
        }

        public double getProbabilityOfHalfLoss() {
            return probabilityOfHalfLoss;
        }

        public double getProbabilityOfTotalLoss() {
            return probabilityOfTotalLoss;
        }

        public double getMaxDrawdownMean() {
            return maxDrawdownMean;
        }

        public double getMaxDrawdownStd() {
            return maxDrawdownStd;
        }

        @Override
        public String toString() {
            return String.format("any loss %.4f, 50%% loss %.4f, 100%% loss %.4f, drawdown %.2f +/- %.2f",
                    probabilityOfAnyLoss, probabilityOfHalfLoss, probabilityOfTotalLoss, maxDrawdownMean,
                    maxDrawdownStd);
        }
    }
}
