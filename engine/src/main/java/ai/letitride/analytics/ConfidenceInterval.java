package ai.letitride.analytics;

import java.util.Objects;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * A two-sided interval estimate at a given confidence level.
 */
public final class ConfidenceInterval {
    private final double lower;
    private final double upper;
    private final double level;

    public ConfidenceInterval(double lower, double upper, double level) {
        if (lower > upper) {
            throw new IllegalArgumentException("Lower bound " + lower + " is above upper bound " + upper);
        }
        this.lower = lower;
        this.upper = upper;
        this.level = level;
    }

    /**
     * Wilson score interval for a proportion, clamped to [0, 1].
     *
     * @throws IllegalArgumentException if {@code total} is not positive, {@code successes} is outside
     *                                  [0, total] or the level is outside (0, 1)
     */
    public static ConfidenceInterval wilson(long successes, long total, double level) {
        checkLevel(level);
        if (total <= 0) {
            throw new IllegalArgumentException("Total must be positive, got " + total);
        }
        if (successes < 0 || successes > total) {
            throw new IllegalArgumentException("Successes must be between 0 and " + total + ", got " + successes);
        }
        double p = successes / (double) total;
        double z = new NormalDistribution().inverseCumulativeProbability((1 + level) / 2);
        double z2 = z * z;
        double denominator = 1 + z2 / total;
        double center = (p + z2 / (2.0 * total)) / denominator;
        double margin = z * Math.sqrt((p * (1 - p) + z2 / (4.0 * total)) / total) / denominator;
        return new ConfidenceInterval(Math.max(0.0, center - margin), Math.min(1.0, center + margin), level);
    }

    /**
     * Student-t interval for the mean of {@code data}. With fewer than two values the interval
     * collapses to the single value (or 0 for no data).
     */
    public static ConfidenceInterval mean(double[] data, double level) {
        checkLevel(level);
        if (data.length < 2) {
            double value = data.length == 1 ? data[0] : 0.0;
            return new ConfidenceInterval(value, value, level);
        }
        SummaryStatistics summary = new SummaryStatistics();
        for (double value : data) {
            summary.addValue(value);
        }
        double t = new TDistribution(data.length - 1).inverseCumulativeProbability(1 - (1 - level) / 2);
        double margin = t * summary.getStandardDeviation() / Math.sqrt(data.length);
        return new ConfidenceInterval(summary.getMean() - margin, summary.getMean() + margin, level);
    }

    static void checkLevel(double level) {
        if (!(level > 0 && level < 1)) {
            throw new IllegalArgumentException("Confidence level must be between 0 and 1 (exclusive), got " + level);
        }
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public double getLevel() {
        return level;
    }

    public double getWidth() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfidenceInterval)) {
            return false;
        }
        ConfidenceInterval that = (ConfidenceInterval) o;
        return Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0
                && Double.compare(level, that.level) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper, level);
    }

    @Override
    public String toString() {
        return String.format("%.0f%% CI [%.4f, %.4f]", level * 100, lower, upper);
    }
}
